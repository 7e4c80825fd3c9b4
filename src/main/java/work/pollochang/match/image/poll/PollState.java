package work.pollochang.match.image.poll;

public enum PollState {
    POLLING("輪詢中"),
    FOUND("已達成"),
    TIMED_OUT("等待逾時"),
    CANCELLED("已取消");

    private final String description;
    PollState(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isTerminal() {
        return this != POLLING;
    }
}
