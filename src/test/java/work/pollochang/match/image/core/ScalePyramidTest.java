package work.pollochang.match.image.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScalePyramidTest {

    private static SampleImage gray(int width, int height, int... values) {
        return new SampleImage(width, height, SampleLayout.LUMINANCE, new int[][]{values});
    }

    @Test
    void testScaledLength() {
        assertEquals(28, ScalePyramid.scaledLength(40, 0.7));
        assertEquals(5, ScalePyramid.scaledLength(10, 0.5));
        assertEquals(9, ScalePyramid.scaledLength(10, 0.81));
        assertEquals(1, ScalePyramid.scaledLength(3, 0.01));
        assertEquals(20, ScalePyramid.scaledLength(10, 2.0));
    }

    /**
     * 比例 1.0 時與原圖完全相同
     */
    @Test
    void testResize_ScaleOne_ShouldBeIdentity() {
        SampleImage source = gray(3, 2, 1, 50, 99, 7, 0, 255);

        ScaledTemplate scaled = ScalePyramid.resize(source, 1.0);

        assertEquals(3, scaled.width());
        assertEquals(2, scaled.height());
        assertArrayEquals(new double[]{1, 50, 99, 7, 0, 255}, scaled.planes()[0]);
    }

    /**
     * 放大時使用像素中心對齊的雙線性內插，邊界夾住
     */
    @Test
    void testResize_Upscale_ShouldInterpolate() {
        SampleImage source = gray(2, 1, 0, 100);

        ScaledTemplate scaled = ScalePyramid.resize(source, 2.0);

        assertEquals(4, scaled.width());
        assertEquals(2, scaled.height());
        assertArrayEquals(new double[]{0, 25, 75, 100, 0, 25, 75, 100}, scaled.planes()[0], 1e-4);
    }

    /**
     * 縮小為一半時取兩像素的平均
     */
    @Test
    void testResize_Downscale_ShouldAverage() {
        SampleImage source = gray(4, 1, 0, 100, 200, 40);

        ScaledTemplate scaled = ScalePyramid.resize(source, 0.5);

        assertEquals(2, scaled.width());
        assertEquals(1, scaled.height());
        assertArrayEquals(new double[]{50, 120}, scaled.planes()[0], 1e-4);
    }

    /**
     * 大於搜尋範圍的比例直接略過，重複的比例只做一次
     */
    @Test
    void testBuild_ShouldSkipTooLargeAndDuplicateScales() {
        SampleImage template = gray(10, 10, new int[100]);
        MatchConfig config = MatchConfig.defaults().withScaleSteps(List.of(1.5, 1.0, 0.5, 1.0, 0.8));

        List<ScaledTemplate> pyramid = ScalePyramid.build(template, config, 12, 9);

        assertEquals(2, pyramid.size());
        assertEquals(0.5, pyramid.get(0).scale());
        assertEquals(5, pyramid.get(0).width());
        assertEquals(0.8, pyramid.get(1).scale());
        assertEquals(8, pyramid.get(1).height());
    }

    /**
     * 關閉多尺度時只用 1.0
     */
    @Test
    void testBuild_SingleScale() {
        SampleImage template = gray(4, 4, new int[16]);
        MatchConfig config = MatchConfig.defaults().withSearchMultipleScales(false);

        List<ScaledTemplate> pyramid = ScalePyramid.build(template, config, 4, 4);

        assertEquals(1, pyramid.size());
        assertEquals(1.0, pyramid.get(0).scale());
        assertTrue(ScalePyramid.build(template, config, 3, 4).isEmpty());
    }
}
