package work.upft.tokens.manifest;

public record ManifestOptions(boolean resolveReferences) {
    public static final ManifestOptions DEFAULT = new ManifestOptions(false);
}
