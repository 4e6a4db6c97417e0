package tech.yump.credstore.audit;

public final class AuditOutcome {

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    private AuditOutcome() {
    }
}
