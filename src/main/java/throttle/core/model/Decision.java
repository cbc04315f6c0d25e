package throttle.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
