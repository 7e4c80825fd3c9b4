package work.pollochang.match.image.core;

/**
 * 正規化後的樣本排列方式。
 */
public enum SampleLayout {
    /** 三個顏色平面，樣本值 0 ~ 255。 */
    RGB(3, 1),
    /** 單一亮度平面，樣本值為 299R + 587G + 114B (即亮度的 1000 倍)，範圍 0 ~ 255000。 */
    LUMINANCE(1, 1000);

    private final int planes;
    private final int unit;

    SampleLayout(int planes, int unit) {
        this.planes = planes;
        this.unit = unit;
    }

    public int planes() { return planes; }

    /** 一個灰階等級對應的樣本值。 */
    public int unit() { return unit; }
}
