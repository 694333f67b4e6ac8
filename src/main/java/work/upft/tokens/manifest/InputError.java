package work.upft.tokens.manifest;

public record InputError(String modifier, String message, Object received, String expected) {
    public String describe() {
        return modifier + ": " + message;
    }
}
