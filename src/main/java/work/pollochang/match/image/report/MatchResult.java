package work.pollochang.match.image.report;

/**
 * 一筆比對結果。座標永遠是整張畫面的絕對座標，不論搜尋時是否限制了區域。
 *
 * @param x          左上角 x
 * @param y          左上角 y
 * @param width      樣板原始寬度乘以 scale (向上取整)
 * @param height     樣板原始高度乘以 scale (向上取整)
 * @param confidence 信心分數 [0, 1]
 * @param scale      命中的樣板縮放比例
 */
public record MatchResult(int x, int y, int width, int height, double confidence, double scale) {

    /**
     * 中心點 {@code (round(x + width / 2), round(y + height / 2))}。
     */
    public MatchPoint center() {
        return new MatchPoint(
                (int) Math.round(x + width / 2.0),
                (int) Math.round(y + height / 2.0));
    }

    public MatchBounds bounds() {
        return new MatchBounds(x, y, x + width, y + height);
    }
}
