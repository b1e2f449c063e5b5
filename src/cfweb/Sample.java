package cfweb;

public class Sample {

    /** 1-based, in page order. */
    public final int index;
    public final String input;
    public final String output;

    public Sample(int index, String input, String output) {
        this.index = index;
        this.input = input;
        this.output = output;
    }

    @Override
    public String toString() {
        return String.format("Sample #%d", index);
    }
}
