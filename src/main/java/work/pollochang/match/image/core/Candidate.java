package work.pollochang.match.image.core;

/**
 * 單一比例下信心分數達標的位置，尚未去除重複。座標相對於搜尋範圍。
 */
public record Candidate(int x, int y, int width, int height, double confidence, double scale) {

    public long area() {
        return (long) width * height;
    }

    /**
     * Intersection-over-Union，兩矩形不相交時為 0。
     */
    public double iou(Candidate other) {
        long intersection = intersectionArea(other);
        if (intersection == 0) {
            return 0.0;
        }
        return (double) intersection / (area() + other.area() - intersection);
    }

    /**
     * 其中一個矩形是否完全包含另一個。
     */
    public boolean nested(Candidate other) {
        return contains(other) || other.contains(this);
    }

    private boolean contains(Candidate other) {
        return other.x >= x && other.y >= y
                && other.x + other.width <= x + width
                && other.y + other.height <= y + height;
    }

    private long intersectionArea(Candidate other) {
        long w = Math.min(x + width, other.x + other.width) - Math.max(x, other.x);
        long h = Math.min(y + height, other.y + other.height) - Math.max(y, other.y);
        return (w <= 0 || h <= 0) ? 0 : w * h;
    }
}
