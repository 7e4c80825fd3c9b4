package work.pollochang.match.image.core;

/**
 * 依某個比例縮放後的樣板。樣本為雙線性內插的結果，因此是浮點數。
 *
 * @param scale  縮放比例
 * @param width  縮放後寬度
 * @param height 縮放後高度
 * @param layout 樣本排列方式
 * @param planes {@code planes[c][y * width + x]}
 */
public record ScaledTemplate(double scale, int width, int height, SampleLayout layout, double[][] planes) {

    public int area() {
        return width * height;
    }
}
