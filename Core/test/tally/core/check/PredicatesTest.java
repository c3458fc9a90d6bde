package tally.core.check;

import org.junit.Assert;
import org.junit.Test;
import tally.core.helper.AssertHelper;

import java.math.BigDecimal;

public class PredicatesTest {

    @Test
    public void testCloseExcludesTheBoundaries() {
        Assert.assertTrue(Predicates.close(3.0, 3.0001, 0.001));
        Assert.assertTrue(Predicates.close(1, 2, 1.5));
        Assert.assertFalse(Predicates.close(1, 2, 1));
        Assert.assertFalse(Predicates.close(2, 1, 1));
        Assert.assertFalse(Predicates.close(3.0f, 3.01, 0.001));
        Assert.assertFalse(Predicates.close(1, 1, 0));
    }

    @Test
    public void testCloseWithNaNIsFalse() {
        Assert.assertFalse(Predicates.close(Double.NaN, 1.0, 10.0));
        Assert.assertFalse(Predicates.close(1.0, 1.0, Double.NaN));
    }

    @Test
    public void testNumbersCompareByValueAcrossTypes() {
        Assert.assertTrue(Predicates.equal(2, 2L));
        Assert.assertTrue(Predicates.equal(3.0f, 3.0));
        Assert.assertTrue(Predicates.equal(new BigDecimal("2.50"), 2.5));
        Assert.assertFalse(Predicates.equal(1, 2));
        Assert.assertTrue(Predicates.less(3.0f, 3.1));
        Assert.assertTrue(Predicates.lessOrEqual(3.0f, 3.0));
        Assert.assertTrue(Predicates.more(3.0f, 2.9));
        Assert.assertTrue(Predicates.moreOrEqual(3, 3L));
        Assert.assertFalse(Predicates.more(3.0f, 3.1));
    }

    @Test
    public void testNaNMakesOrderingsFalse() {
        Assert.assertFalse(Predicates.less(Double.NaN, 1));
        Assert.assertFalse(Predicates.lessOrEqual(Double.NaN, Double.NaN));
        Assert.assertFalse(Predicates.more(1, Float.NaN));
        Assert.assertFalse(Predicates.moreOrEqual(Double.NaN, 1));
        Assert.assertFalse(Predicates.equal(Double.NaN, Double.NaN));
        Assert.assertTrue(Predicates.differ(Double.NaN, Double.NaN));
    }

    @Test
    public void testNonNumericOperands() {
        Assert.assertTrue(Predicates.equal("a", "a"));
        Assert.assertTrue(Predicates.equal(null, null));
        Assert.assertFalse(Predicates.equal("a", null));
        Assert.assertTrue(Predicates.less("a", "b"));
        Assert.assertFalse(Predicates.less("a", 1));
        Assert.assertFalse(Predicates.less(null, "a"));
        Assert.assertTrue(Predicates.equal(new int[]{ 1, 2 }, new int[]{ 1, 2 }));
        Assert.assertTrue(Predicates.differ(new int[]{ 1, 2 }, new int[]{ 2, 1 }));
    }

    @Test
    public void testSameDataWithZeroSizeIsAlwaysTrue() {
        Assert.assertTrue(Predicates.sameData(null, null, 0));
        Assert.assertTrue(Predicates.sameData(new byte[]{ 1 }, null, 0));
        Assert.assertTrue(Predicates.sameData(new byte[]{ 1 }, new byte[]{ 2 }, 0));
    }

    @Test
    public void testSameDataWithTheSameArray() {
        byte[] data = { 1, 2, 3 };
        Assert.assertTrue(Predicates.sameData(data, data, 3));
    }

    @Test
    public void testSameDataWithOneNull() {
        Assert.assertFalse(Predicates.sameData(new byte[]{ 1 }, null, 1));
        Assert.assertFalse(Predicates.sameData(null, new byte[]{ 1 }, 1));
        Assert.assertFalse(Predicates.sameData(null, new byte[]{ 1 }, 5));
        Assert.assertFalse(Predicates.sameData(new byte[]{ 1 }, null, 5));
    }

    @Test
    public void testSameDataWithIdenticalArrayIgnoresSize() {
        byte[] data = { 4, 2 };
        Assert.assertTrue(Predicates.sameData(data, data, 3));
        Assert.assertTrue(Predicates.sameData(null, null, 7));
    }

    @Test
    public void testSameDataComparesOnlyThePrefix() {
        byte[] x = { 0, 1, 2, 3 };
        byte[] y = { 0, 1, 2, 9 };
        Assert.assertTrue(Predicates.sameData(x, y, 3));
        Assert.assertFalse(Predicates.sameData(x, y, 4));
    }

    @Test
    public void testSameDataRejectsBadSizes() {
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> Predicates.sameData(new byte[2], new byte[3], 3));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> Predicates.sameData(new byte[2], new byte[2], -1));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> Predicates.sameData(new byte[3], new byte[2], 3));
    }
}
