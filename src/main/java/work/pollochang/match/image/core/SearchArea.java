package work.pollochang.match.image.core;

import org.opencv.core.Mat;

/**
 * 一次搜尋中所有比例共用的畫面資料：正規化後的樣本、每個平面的整數積分圖，
 * 以及第一次需要時才建立的 OpenCV 影像。只在單次呼叫內使用，不可跨執行緒共用。
 */
final class SearchArea implements AutoCloseable {

    private final SampleImage samples;
    private final long[][] sums;
    private final long[][] squares;
    private final int stride;
    private Mat mat;

    private SearchArea(SampleImage samples, long[][] sums, long[][] squares) {
        this.samples = samples;
        this.sums = sums;
        this.squares = squares;
        this.stride = samples.width() + 1;
    }

    static SearchArea of(SampleImage samples) {
        int width = samples.width();
        int height = samples.height();
        int planes = samples.planes().length;
        int stride = width + 1;
        long[][] sums = new long[planes][stride * (height + 1)];
        long[][] squares = new long[planes][stride * (height + 1)];
        for (int c = 0; c < planes; c++) {
            int[] plane = samples.planes()[c];
            long[] s = sums[c];
            long[] q = squares[c];
            for (int y = 0; y < height; y++) {
                long rowSum = 0;
                long rowSquares = 0;
                int above = y * stride;
                int here = (y + 1) * stride;
                for (int x = 0; x < width; x++) {
                    long v = plane[y * width + x];
                    rowSum += v;
                    rowSquares += v * v;
                    s[here + x + 1] = s[above + x + 1] + rowSum;
                    q[here + x + 1] = q[above + x + 1] + rowSquares;
                }
            }
        }
        return new SearchArea(samples, sums, squares);
    }

    SampleImage samples() {
        return samples;
    }

    long windowSum(int plane, int x, int y, int width, int height) {
        return rectangle(sums[plane], x, y, width, height);
    }

    long windowSquares(int plane, int x, int y, int width, int height) {
        return rectangle(squares[plane], x, y, width, height);
    }

    Mat mat() {
        if (mat == null) {
            mat = OpenCvSupport.toMat(samples);
        }
        return mat;
    }

    private long rectangle(long[] table, int x, int y, int width, int height) {
        int top = y * stride;
        int bottom = (y + height) * stride;
        return table[bottom + x + width] - table[bottom + x] - table[top + x + width] + table[top + x];
    }

    @Override
    public void close() {
        if (mat != null) {
            mat.release();
            mat = null;
        }
    }
}
