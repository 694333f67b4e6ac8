package work.upft.tokens.manifest;

import java.util.List;

public record InputValidation(List<InputError> errors) {
    public InputValidation {
        errors = List.copyOf(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
