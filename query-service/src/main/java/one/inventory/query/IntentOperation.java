package one.inventory.query;

/**
 * 意图的操作分类
 */
public enum IntentOperation {
    READ("GET"),
    WRITE("POST"),
    UNSUPPORTED(null);

    private final String wireName;

    IntentOperation(String wireName) {
        this.wireName = wireName;
    }

    public static IntentOperation of(String operation) {
        for (IntentOperation value : values()) {
            if (value.wireName != null && value.wireName.equals(operation)) {
                return value;
            }
        }
        return UNSUPPORTED;
    }
}
