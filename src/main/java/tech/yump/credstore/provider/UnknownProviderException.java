package tech.yump.credstore.provider;

/**
 * Thrown when a provider id is not part of the configured provider set.
 */
public class UnknownProviderException extends IllegalArgumentException {

    public UnknownProviderException(String providerId) {
        super("Unknown provider: " + providerId);
    }
}
