package sdkusage.querybridge.schema;

/**
 * Manifest content that cannot be turned into a catalog.
 */
public class SchemaLoadException extends Exception {

    public SchemaLoadException(String message) {
        super(message);
    }
}
