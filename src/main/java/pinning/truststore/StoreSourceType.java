package pinning.truststore;

public enum StoreSourceType {
    SYSTEM_DEFAULT,
    FILE,
    URL
}
