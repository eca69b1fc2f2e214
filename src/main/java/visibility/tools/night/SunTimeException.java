package visibility.tools.night;

public class SunTimeException extends Exception {

    public enum Kind {
        NEVER_RISES,
        NEVER_SETS
    }

    private final Kind kind;

    public SunTimeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

}
