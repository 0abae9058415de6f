package ops;

/** Value types an operation parameter can take. */
public enum ParamType {
    INTEGER,
    FLOAT,
    ENUM,
    BOOLEAN,
    COLOR,
    POINT,
    RECTANGLE
}
