package work.pollochang.match.image.core;

import work.pollochang.match.image.exception.ValidationException;

/**
 * 畫面上的矩形搜尋區域，座標為整張畫面的絕對座標。
 *
 * @param x      左上角 x
 * @param y      左上角 y
 * @param width  寬度，必須大於 0
 * @param height 高度，必須大於 0
 */
public record Region(int x, int y, int width, int height) {

    /**
     * 涵蓋整張影像的區域。
     */
    public static Region of(ImageResource image) {
        return new Region(0, 0, image.width(), image.height());
    }

    /**
     * 確認區域尺寸為正，且完全落在 {@code boundsWidth x boundsHeight} 的畫面內。
     *
     * @throws ValidationException 區域無效或超出畫面
     */
    public void validateWithin(int boundsWidth, int boundsHeight) {
        if (width <= 0 || height <= 0) {
            throw new ValidationException("搜尋區域尺寸必須大於 0: " + this);
        }
        if (x < 0 || y < 0 || (long) x + width > boundsWidth || (long) y + height > boundsHeight) {
            throw new ValidationException(String.format("搜尋區域 %s 超出畫面範圍 %dx%d", this, boundsWidth, boundsHeight));
        }
    }
}
