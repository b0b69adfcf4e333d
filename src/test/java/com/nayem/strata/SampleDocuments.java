package com.nayem.strata;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.nayem.strata.model.Algorithm;
import com.nayem.strata.model.AlgorithmVariable;
import com.nayem.strata.model.CoreDocument;
import com.nayem.strata.model.Dimension;
import com.nayem.strata.model.ExtensionSource;
import com.nayem.strata.model.Mode;
import com.nayem.strata.model.ModeValue;
import com.nayem.strata.model.NamingRules;
import com.nayem.strata.model.Platform;
import com.nayem.strata.model.Taxonomy;
import com.nayem.strata.model.TaxonomyTerm;
import com.nayem.strata.model.Theme;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenCollection;
import com.nayem.strata.model.TokenValue;
import com.nayem.strata.model.ValueByMode;
import com.nayem.strata.model.ValueType;

import java.util.List;

/**
 * A small two-dimension design system shared by the tests.
 * <p>
 * Modes: {@code light}/{@code dark} (color-scheme) and
 * {@code compact}/{@code comfortable} (density). Platforms {@code ios} and
 * {@code web}. Themes {@code classic} (default) and {@code ocean}.
 * </p>
 */
public final class SampleDocuments {

    public static final String SYSTEM_ID = "acme";

    private SampleDocuments() {
    }

    public static TokenValue text(String value) {
        return TokenValue.literal(TextNode.valueOf(value));
    }

    public static ValueByMode value(String mode, String value) {
        return new ValueByMode(List.of(mode), text(value));
    }

    public static Token primaryColor() {
        return Token.builder("color.primary")
                .displayName("Primary")
                .tokenCollectionId("colors")
                .resolvedValueTypeId("color")
                .themeable(true)
                .value(List.of("light"), text("#0055ff"))
                .value(List.of("dark"), text("#66aaff"))
                .build();
    }

    public static Token smallSpacing() {
        return Token.builder("spacing.small")
                .tokenCollectionId("spacing")
                .resolvedValueTypeId("dimension")
                .value(List.of("compact"), text("4px"))
                .value(List.of("comfortable"), text("8px"))
                .build();
    }

    public static Token textColor() {
        return Token.builder("color.text")
                .tokenCollectionId("colors")
                .resolvedValueTypeId("color")
                .themeable(true)
                .value(List.of("light"), TokenValue.alias("color.primary"))
                .build();
    }

    public static CoreDocument core() {
        return core(List.of(primaryColor(), smallSpacing(), textColor()));
    }

    public static CoreDocument core(List<Token> tokens) {
        Dimension colorScheme = new Dimension("color-scheme", "Color scheme", null,
                List.of(new Mode("light", "Light", null, "color-scheme"),
                        new Mode("dark", "Dark", null, "color-scheme")),
                true, "light");
        Dimension density = new Dimension("density", "Density", null,
                List.of(new Mode("compact", "Compact", null, "density"),
                        new Mode("comfortable", "Comfortable", null, "density")),
                false, "comfortable");
        return new CoreDocument(SYSTEM_ID, "Acme Design System", "2.1.0",
                tokens,
                List.of(new TokenCollection("colors", "Colors", null, List.of("color"), false, List.of("light")),
                        new TokenCollection("spacing", "Spacing", null, List.of("dimension"), false,
                                List.of("comfortable"))),
                List.of(colorScheme, density),
                List.of(new Platform("ios", "iOS", null, null, null,
                                new ExtensionSource("acme/tokens-ios", "ios.json")),
                        new Platform("web", "Web", null, null, null, null)),
                List.of(new Theme("classic", "Classic", null, true, null),
                        new Theme("ocean", "Ocean", null, false, null)),
                List.of(new Taxonomy("category", "Category", null,
                        List.of(new TaxonomyTerm("color", "Color", null)))),
                List.of(new Algorithm("scale", "Spacing scale", null,
                        List.of(new AlgorithmVariable("base", "Base", "number",
                                List.of(new ModeValue(List.of(), IntNode.valueOf(4))))))),
                List.of(new ValueType("color", "Color", "color"), new ValueType("dimension", "Dimension", "dimension")),
                new NamingRules(List.of("category")),
                List.of("color-scheme", "density"));
    }
}
