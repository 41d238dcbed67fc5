package com.smoke.temporal.processor;

import com.smoke.temporal.model.Region;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegionLayoutTest {

    @Test
    void testFullHdLayout() {
        List<Region> regions = RegionLayout.defineRegions(1920, 1080);

        assertEquals(9, regions.size());

        Region first = regions.get(0);
        assertEquals("R1", first.getName());
        assertEquals(0, first.getX0());
        assertEquals(0, first.getY0());
        assertEquals(768, first.getX1());
        assertEquals(432, first.getY1());

        Region center = regions.get(4);
        assertEquals("R5", center.getName());
        assertEquals(1, center.getRow());
        assertEquals(1, center.getCol());
        assertEquals(576, center.getX0());
        assertEquals(324, center.getY0());
        assertEquals(1344, center.getX1());
        assertEquals(756, center.getY1());

        Region last = regions.get(8);
        assertEquals("R9", last.getName());
        assertEquals(1152, last.getX0());
        assertEquals(648, last.getY0());
        assertEquals(1920, last.getX1());
        assertEquals(1080, last.getY1());
    }

    @Test
    void testRowColumnOrder() {
        List<Region> regions = RegionLayout.defineRegions(640, 480);
        for (int i = 0; i < regions.size(); i++) {
            Region region = regions.get(i);
            assertEquals(i / 3, region.getRow());
            assertEquals(i % 3, region.getCol());
            assertEquals(i, region.getIndex());
            assertEquals("R" + (i + 1), region.getName());
        }
    }

    @Test
    void testNeighbouringRegionsOverlap() {
        List<Region> regions = RegionLayout.defineRegions(1000, 500);
        // 40% 覆盖，30% 间距 -> 10% 帧宽的重叠
        assertEquals(400, regions.get(0).getX1());
        assertEquals(300, regions.get(1).getX0());
        assertTrue(regions.get(1).getX0() < regions.get(0).getX1());
        assertTrue(regions.get(3).getY0() < regions.get(0).getY1());
    }

    @Test
    void testBoundsStayInsideFrame() {
        int[][] sizes = {{1, 1}, {7, 3}, {33, 17}, {101, 57}, {640, 360}, {1921, 1079}};
        for (int[] size : sizes) {
            for (Region region : RegionLayout.defineRegions(size[0], size[1])) {
                assertTrue(region.getX0() >= 0 && region.getY0() >= 0);
                assertTrue(region.getX1() <= size[0], "x1 exceeds width for " + size[0]);
                assertTrue(region.getY1() <= size[1], "y1 exceeds height for " + size[1]);
                assertTrue(region.getX0() <= region.getX1());
                assertTrue(region.getY0() <= region.getY1());
            }
        }
    }

    @Test
    void testDegenerateFrameGivesEmptyRegions() {
        List<Region> zero = RegionLayout.defineRegions(0, 0);
        assertEquals(9, zero.size());
        zero.forEach(region -> assertEquals(region.getX0(), region.getX1()));

        // 2像素宽时 40% 取整为0
        List<Region> tiny = RegionLayout.defineRegions(2, 2);
        tiny.forEach(region -> assertEquals(region.getX0(), region.getX1()));
    }

    @Test
    void testLayoutIsDeterministic() {
        assertEquals(RegionLayout.defineRegions(1280, 720), RegionLayout.defineRegions(1280, 720));
    }

    @Test
    void testRegionsCannotBeModified() {
        List<Region> regions = RegionLayout.defineRegions(1920, 1080);

        assertThrows(UnsupportedOperationException.class, () -> regions.set(0, regions.get(8)));
        // 区域没有 setter
        assertThrows(NoSuchMethodException.class, () -> Region.class.getMethod("setX1", int.class));
        assertThrows(NoSuchMethodException.class, () -> Region.class.getMethod("setName", String.class));
    }
}
