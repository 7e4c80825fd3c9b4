package work.pollochang.match.image.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageNormalizerTest {

    private static ImageResource image(int width, int height, int channels, int... values) {
        byte[] buffer = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            buffer[i] = (byte) values[i];
        }
        return new ImageResource(buffer, width, height, channels, null);
    }

    @Test
    void testChooseLayout() {
        ImageResource rgb = image(1, 1, 3, 1, 2, 3);
        ImageResource rgba = image(1, 1, 4, 1, 2, 3, 4);
        ImageResource gray = image(1, 1, 1, 9);

        assertEquals(SampleLayout.RGB, ImageNormalizer.chooseLayout(rgb, rgba, false));
        assertEquals(SampleLayout.LUMINANCE, ImageNormalizer.chooseLayout(rgb, rgba, true));
        assertEquals(SampleLayout.LUMINANCE, ImageNormalizer.chooseLayout(gray, rgb, false));
        assertEquals(SampleLayout.LUMINANCE, ImageNormalizer.chooseLayout(gray, gray, false));
    }

    /**
     * 亮度 = 299R + 587G + 114B
     */
    @Test
    void testLuminance() {
        assertEquals(255_000, ImageNormalizer.luminance(255, 255, 255));
        assertEquals(299 * 10 + 587 * 20 + 114 * 30, ImageNormalizer.luminance(10, 20, 30));
        assertEquals(0, ImageNormalizer.luminance(0, 0, 0));
    }

    /**
     * alpha 通道不參與比對
     */
    @Test
    void testNormalize_Rgba_ShouldDropAlpha() {
        ImageResource rgba = image(2, 1, 4, 10, 20, 30, 255, 40, 50, 60, 0);

        SampleImage rgb = ImageNormalizer.normalize(rgba, SampleLayout.RGB);
        assertArrayEquals(new int[]{10, 40}, rgb.planes()[0]);
        assertArrayEquals(new int[]{20, 50}, rgb.planes()[1]);
        assertArrayEquals(new int[]{30, 60}, rgb.planes()[2]);

        SampleImage lum = ImageNormalizer.normalize(rgba, SampleLayout.LUMINANCE);
        assertEquals(1, lum.planes().length);
        assertEquals(ImageNormalizer.luminance(40, 50, 60), lum.sample(0, 1, 0));
    }

    /**
     * 灰階值以 1000 倍保存，與彩色亮度同一單位
     */
    @Test
    void testNormalize_Gray_ShouldUseSameUnitAsLuminance() {
        ImageResource grayAlpha = image(2, 1, 2, 100, 7, 200, 7);

        SampleImage lum = ImageNormalizer.normalize(grayAlpha, SampleLayout.LUMINANCE);
        assertArrayEquals(new int[]{100_000, 200_000}, lum.planes()[0]);

        SampleImage rgb = ImageNormalizer.normalize(grayAlpha, SampleLayout.RGB);
        assertArrayEquals(new int[]{100, 200}, rgb.planes()[0]);
        assertArrayEquals(new int[]{100, 200}, rgb.planes()[2]);
    }

    /**
     * 只讀取區域內的像素
     */
    @Test
    void testNormalize_Region_ShouldCrop() {
        ImageResource gray = image(3, 3, 1,
                1, 2, 3,
                4, 5, 6,
                7, 8, 9);

        SampleImage cropped = ImageNormalizer.normalize(gray, new Region(1, 1, 2, 2), SampleLayout.LUMINANCE);

        assertEquals(2, cropped.width());
        assertEquals(2, cropped.height());
        assertArrayEquals(new int[]{5000, 6000, 8000, 9000}, cropped.planes()[0]);
    }
}
