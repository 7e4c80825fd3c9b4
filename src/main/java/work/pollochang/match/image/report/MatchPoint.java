package work.pollochang.match.image.report;

public record MatchPoint(int x, int y) {}
