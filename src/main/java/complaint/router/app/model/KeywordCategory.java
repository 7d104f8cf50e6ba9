package complaint.router.app.model;

public enum KeywordCategory {
    COMPLAINT,
    SUBJECT,
    URGENCY,
    NEGATION
}
