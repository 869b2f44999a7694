package com.mymemo.service;

public final class BotReplies {

    public static final String EMPTY_MESSAGE = "I need a message to work with. Please try again.";
    public static final String BAD_REQUEST = "Sorry, I couldn't understand that request.";
    public static final String TRY_AGAIN = "Sorry, that took too long. Please try again.";

    public static final String ASK_PRIORITY =
            "What priority should I set? Reply with a number between 1 (low) and 5 (high).";
    public static final String INVALID_PRIORITY =
            "Please send a priority between 1 (lowest) and 5 (highest).";
    public static final String LOST_PENDING = "I lost track of that reminder. Please send it again.";
    public static final String SAVE_FAILED = "I couldn't save the reminder. Please try again.";
    public static final String SAVED = "Got it! I'll remind you: %s (priority %d).";

    public static final String NO_REMINDERS = "You have no reminders yet. Send me one to get started!";
    public static final String LIST_HEADER = "Here are your reminders:\n";
    public static final String LIST_FAILED = "I couldn't load your reminders right now. Please try again later.";

    public static final String CLEARED = "All reminders cleared.";
    public static final String NOTHING_TO_CLEAR = "You don't have any reminders to clear.";
    public static final String CLEAR_FAILED = "I couldn't clear your reminders. Please try again later.";

    public static final String ASK_DELETE_TARGET =
            "Tell me which reminder to delete, e.g. 'delete reminder about milk'.";
    public static final String DELETED_INDICES = "Deleted reminder(s): %s.";
    public static final String DELETED_MATCHING = "Deleted reminders matching '%s'.";
    public static final String NO_MATCH = "I couldn't find any reminders matching that description.";
    public static final String NO_REMINDERS_TO_DELETE = "You don't have any reminders yet.";
    public static final String INDEX_OUT_OF_RANGE = "Reminder %d doesn't exist. Choose between 1 and %d.";
    public static final String INDEX_DELETE_NOTHING = "I couldn't delete those reminders. Please try again later.";
    public static final String DELETE_FAILED = "I couldn't delete that reminder. Please try again later.";

    public static final String HELP = "You can say things like:\n"
            + "- \"Remind me to pay rent\" to add a reminder\n"
            + "- \"List reminders\" to see everything saved\n"
            + "- \"Delete reminder about rent\" to remove one\n"
            + "- \"Delete 1, 3\" to remove reminders by their number in the list\n"
            + "- \"Clear all reminders\" to wipe everything";

    public static final String SCHEDULED_REMINDER = "Reminder: %s (priority %d)";

    private BotReplies() {}
}
