package sdkusage.querybridge.translation;

/**
 * No query can be derived from a question, for example when the catalog has no enabled table.
 */
public class TranslationException extends Exception {

    public TranslationException(String message) {
        super(message);
    }
}
