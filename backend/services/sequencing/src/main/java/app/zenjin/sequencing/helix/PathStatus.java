package app.zenjin.sequencing.helix;

public enum PathStatus {
    ACTIVE,
    PREPARING
}
