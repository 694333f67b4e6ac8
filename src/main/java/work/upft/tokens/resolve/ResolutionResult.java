package work.upft.tokens.resolve;

import java.util.List;

public record ResolutionResult(List<ResolutionError> errors, int resolvedCount, int unresolvedCount) {
    public ResolutionResult {
        errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public List<ResolutionError> errorsOfKind(ResolutionError.Kind kind) {
        return errors.stream().filter(error -> error.kind() == kind).toList();
    }
}
