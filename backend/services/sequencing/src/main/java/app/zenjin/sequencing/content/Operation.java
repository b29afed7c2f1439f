package app.zenjin.sequencing.content;

public enum Operation {
    ADDITION("add"),
    SUBTRACTION("sub"),
    MULTIPLICATION("mult"),
    DIVISION("div");

    private final String idPrefix;
    Operation(String idPrefix) { this.idPrefix = idPrefix; }
    public String idPrefix() { return idPrefix; }
}
