package complaint.router.app.model;

public enum FeedbackStatus {
    NONE,
    FALSE_POSITIVE,
    FALSE_NEGATIVE
}
