package com.gamemaster.resolver;

public class Resolution {

    private static final Resolution UNRESOLVED = new Resolution(null, null);

    private final String choiceId;
    private final String stage;

    private Resolution(String choiceId, String stage) {
        this.choiceId = choiceId;
        this.stage = stage;
    }

    public static Resolution resolved(String choiceId, String stage) {
        return new Resolution(choiceId, stage);
    }

    public static Resolution unresolved() {
        return UNRESOLVED;
    }

    public boolean isResolved() {
        return choiceId != null;
    }

    public String getChoiceId() {
        return choiceId;
    }

    /**
     * Name of the stage that matched, or null when unresolved.
     */
    public String getStage() {
        return stage;
    }

    @Override
    public String toString() {
        return isResolved() ? "Resolution(" + choiceId + " via " + stage + ")" : "Resolution(unresolved)";
    }
}
