package work.upft.tokens.analysis;

import java.util.Optional;

public record TokenListItem(String path, String type, Object value, Optional<Object> resolvedValue, boolean hasReferences) {}
