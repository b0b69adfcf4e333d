package com.nayem.strata.validation;

import com.nayem.strata.model.CoreDocument;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.TokenOverride;
import com.nayem.strata.model.ValueByMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a layer document refers only to things its core document
 * defines. Schema validation must have succeeded first.
 */
public class ReferenceValidator {

    interface Codes {
        String SYSTEM_MISMATCH = "reference.system.mismatch";
        String PLATFORM_UNKNOWN = "reference.platform.unknown";
        String THEME_UNKNOWN = "reference.theme.unknown";
        String MODE_UNKNOWN = "reference.mode.unknown";
        String DIMENSION_UNKNOWN = "reference.dimension.unknown";
        String NEW_TOKEN_VALUE_TYPE = "reference.token.value_type.required";
    }

    public List<ValidationError> validateAgainstCore(CoreDocument core, PlatformExtensionDocument extension) {
        List<ValidationError> errors = new ArrayList<>();
        checkSystem(core, extension.systemId(), errors);
        if (core.platform(extension.platformId()) == null) {
            errors.add(new ValidationError(Codes.PLATFORM_UNKNOWN, "platformId",
                    "platform '" + extension.platformId() + "' is not defined in " + core.systemId()));
        }

        List<TokenOverride> overrides = extension.tokenOverrides();
        for (int i = 0; i < overrides.size(); i++) {
            TokenOverride fragment = overrides.get(i);
            String fragmentPath = "tokenOverrides[" + i + "]";
            if (fragment.valuesByMode() != null) {
                checkModes(core, fragment.valuesByMode(), fragmentPath, errors);
            }
            if (core.token(fragment.id()) == null && !fragment.isOmitted() && fragment.resolvedValueTypeId() == null) {
                errors.add(new ValidationError(Codes.NEW_TOKEN_VALUE_TYPE, fragmentPath + ".resolvedValueTypeId",
                        "new token '" + fragment.id() + "' must declare a resolvedValueTypeId"));
            }
        }

        for (int i = 0; i < extension.omittedModes().size(); i++) {
            String modeId = extension.omittedModes().get(i);
            if (!core.hasMode(modeId)) {
                errors.add(new ValidationError(Codes.MODE_UNKNOWN, "omittedModes[" + i + "]",
                        "omitted mode '" + modeId + "' is not defined"));
            }
        }
        for (int i = 0; i < extension.omittedDimensions().size(); i++) {
            String dimensionId = extension.omittedDimensions().get(i);
            if (core.dimension(dimensionId) == null) {
                errors.add(new ValidationError(Codes.DIMENSION_UNKNOWN, "omittedDimensions[" + i + "]",
                        "omitted dimension '" + dimensionId + "' is not defined"));
            }
        }
        return errors;
    }

    /**
     * Themeability is a policy of the merge, not a reference problem, so it is
     * not checked here.
     */
    public List<ValidationError> validateAgainstCore(CoreDocument core, ThemeOverrideDocument theme) {
        List<ValidationError> errors = new ArrayList<>();
        checkSystem(core, theme.systemId(), errors);
        if (core.theme(theme.themeId()) == null) {
            errors.add(new ValidationError(Codes.THEME_UNKNOWN, "themeId",
                    "theme '" + theme.themeId() + "' is not defined in " + core.systemId()));
        }
        List<ThemeTokenOverride> overrides = theme.tokenOverrides();
        for (int i = 0; i < overrides.size(); i++) {
            checkModes(core, overrides.get(i).valuesByMode(), "tokenOverrides[" + i + "]", errors);
        }
        return errors;
    }

    private static void checkSystem(CoreDocument core, String systemId, List<ValidationError> errors) {
        if (!core.systemId().equals(systemId)) {
            errors.add(new ValidationError(Codes.SYSTEM_MISMATCH, "systemId",
                    "expected systemId '" + core.systemId() + "' but found '" + systemId + "'"));
        }
    }

    private static void checkModes(CoreDocument core, List<ValueByMode> values, String parent,
            List<ValidationError> errors) {
        for (int i = 0; i < values.size(); i++) {
            for (String modeId : values.get(i).modeIds()) {
                if (!core.hasMode(modeId)) {
                    errors.add(new ValidationError(Codes.MODE_UNKNOWN, parent + ".valuesByMode[" + i + "].modeIds",
                            "mode '" + modeId + "' is not defined in any dimension"));
                }
            }
        }
    }
}
