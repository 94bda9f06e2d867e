package tome.lang;

/** Static type of an expression as seen by the analyzer. */
enum InferredType {
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    ANY("any");

    private final String label;

    InferredType(String label) {
        this.label = label;
    }

    String label() {
        return label;
    }

    static InferredType of(Object literal) {
        if (literal instanceof Double) {
            return NUMBER;
        }
        if (literal instanceof String) {
            return STRING;
        }
        if (literal instanceof Boolean) {
            return BOOLEAN;
        }
        return ANY;
    }
}
