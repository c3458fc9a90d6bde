package tally.core.type;

import org.junit.Assert;
import org.junit.Test;

public class ResultTest {

    @Test
    public void testSuccessAndError() {
        Result<Integer> success = Result.successful(3);
        Assert.assertTrue(success.isSuccess());
        Assert.assertEquals(Integer.valueOf(3), success.getData());
        Assert.assertNull(success.getError());

        Result<Integer> error = Result.error("bad");
        Assert.assertFalse(error.isSuccess());
        Assert.assertNull(error.getData());
        Assert.assertEquals("bad", error.getError());
    }
}
