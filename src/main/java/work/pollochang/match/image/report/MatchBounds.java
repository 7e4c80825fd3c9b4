package work.pollochang.match.image.report;

/**
 * 比對結果的邊界，right / bottom 為不含的邊界 ({@code x + width}、{@code y + height})。
 */
public record MatchBounds(int left, int top, int right, int bottom) {}
