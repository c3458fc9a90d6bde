package tally.example;

/**
 * The state of the tests in which a check fails.
 */
public final class FailuresFixture {
    public int i;
    public float f;
    public final byte[] d = new byte[10];

    public FailuresFixture() {
        this.i = 1;
        this.f = 3.0f;
        for (int j = 0; j < this.d.length; j++) {
            this.d[j] = (byte) (10 - j);
        }
    }

    public void tearDown() {
        this.i = 0;
        this.f = 0.0f;
        for (int j = 0; j < this.d.length; j++) {
            this.d[j] = 0;
        }
    }
}
