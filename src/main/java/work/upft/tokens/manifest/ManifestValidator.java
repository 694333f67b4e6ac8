package work.upft.tokens.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.upft.tokens.io.JsonValues;

/**
 * Checks modifier input against a manifest. Every key is checked; nothing fails fast.
 */
public final class ManifestValidator {
    /** Input key that names the output file rather than a modifier. */
    public static final String OUTPUT_KEY = "output";

    private ManifestValidator() {}

    public static InputValidation validateInput(Manifest manifest, Map<String, Object> input) {
        var errors = new ArrayList<InputError>();
        if (input == null) {
            return new InputValidation(errors);
        }
        for (var entry : input.entrySet()) {
            var name = entry.getKey();
            if (OUTPUT_KEY.equals(name)) {
                continue;
            }
            var modifier = manifest.modifier(name);
            if (modifier.isEmpty()) {
                errors.add(new InputError(name, "Unknown modifier", entry.getValue(), "one of: " + String.join(", ", manifest.modifiers().keySet())));
                continue;
            }
            var value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (modifier.get().isOneOf()) {
                checkOneOf(modifier.get(), value, errors);
            } else {
                checkAnyOf(modifier.get(), value, errors);
            }
        }
        return new InputValidation(errors);
    }

    private static void checkOneOf(Modifier modifier, Object value, List<InputError> errors) {
        var expected = "one of: " + String.join(", ", modifier.options());
        if (!(value instanceof String option)) {
            errors.add(new InputError(modifier.name(), "oneOf modifier expects a single string value, got " + JsonValues.typeName(value), value, expected));
            return;
        }
        if (!modifier.hasOption(option)) {
            errors.add(new InputError(modifier.name(), "Invalid value '" + option + "' for oneOf modifier", option, expected));
        }
    }

    private static void checkAnyOf(Modifier modifier, Object value, List<InputError> errors) {
        var expected = "any of: " + String.join(", ", modifier.options());
        if (!(value instanceof List<?> list)) {
            errors.add(new InputError(modifier.name(), "anyOf modifier expects an array of strings, got " + JsonValues.typeName(value), value, expected));
            return;
        }
        for (Object item : list) {
            if (!(item instanceof String option)) {
                errors.add(new InputError(modifier.name(), "anyOf modifier array must contain only strings, got " + JsonValues.typeName(item), item, "string"));
            } else if (!modifier.hasOption(option)) {
                errors.add(new InputError(modifier.name(), "Invalid value '" + option + "' in anyOf modifier array", option, expected));
            }
        }
    }
}
