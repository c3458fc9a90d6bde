package tally.example;

/**
 * The state of the tests in which every check passes.
 */
public final class AssertionsFixture {
    public int i;
    public float f;
    public final byte[] d = new byte[10];

    public AssertionsFixture() {
        this.i = 2;
        this.f = 3.0f;
        for (int j = 0; j < this.d.length; j++) {
            this.d[j] = (byte) j;
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
