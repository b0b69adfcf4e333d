package com.nayem.strata.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Redis implementation of {@link DocumentStore}. Each collection and each
 * snapshot is one JSON string written with a single {@code SET}, so a
 * collection is never left half-written.
 */
public class RedisDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDocumentStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisDocumentStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public <E> List<E> get(StoreCollection<E> collection) {
        String json = redisTemplate.opsForValue().get(collectionKey(collection));
        if (json == null) {
            return List.of();
        }
        try {
            return List.copyOf(objectMapper.readValue(json, collection.listType()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize collection " + collection, e);
        }
    }

    @Override
    public <E> void set(StoreCollection<E> collection, List<E> values) {
        try {
            redisTemplate.opsForValue().set(collectionKey(collection), objectMapper.writeValueAsString(values));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize collection " + collection, e);
        }
    }

    @Override
    public Optional<BaselineSnapshot> getBaseline() {
        return read(keyPrefix + "baseline");
    }

    @Override
    public void setBaseline(BaselineSnapshot baseline) {
        write(keyPrefix + "baseline", baseline);
    }

    @Override
    public Optional<BaselineSnapshot> getSnapshot(String name) {
        return read(snapshotKey(name));
    }

    @Override
    public void setSnapshot(String name, BaselineSnapshot snapshot) {
        write(snapshotKey(name), snapshot);
    }

    @Override
    public void removeSnapshot(String name) {
        redisTemplate.delete(snapshotKey(name));
    }

    private void write(String key, BaselineSnapshot snapshot) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("capturedAt", snapshot.capturedAt().toString());
        ObjectNode data = root.putObject("data");
        for (StoreCollection<?> collection : StoreCollection.ALL) {
            data.set(collection.name(), objectMapper.valueToTree(snapshot.data().get(collection)));
        }
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot " + key, e);
        }
    }

    private Optional<BaselineSnapshot> read(String key) {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode data = root.path("data");
            DataSnapshot.Builder builder = DataSnapshot.builder();
            for (StoreCollection<?> collection : StoreCollection.ALL) {
                readInto(builder, collection, data.get(collection.name()));
            }
            return Optional.of(new BaselineSnapshot(builder.build(), Instant.parse(root.path("capturedAt").asText())));
        } catch (JsonProcessingException | IllegalArgumentException | DateTimeParseException e) {
            log.error("Failed to deserialize snapshot {}", key, e);
            throw new IllegalStateException("Failed to deserialize snapshot " + key, e);
        }
    }

    private <E> void readInto(DataSnapshot.Builder builder, StoreCollection<E> collection, JsonNode values) {
        if (values == null || values.isNull()) {
            builder.put(collection, List.of());
            return;
        }
        builder.put(collection, objectMapper.convertValue(values, collection.listType()));
    }

    private String collectionKey(StoreCollection<?> collection) {
        return keyPrefix + "collection:" + collection.name();
    }

    private String snapshotKey(String name) {
        return keyPrefix + "snapshot:" + name;
    }
}
