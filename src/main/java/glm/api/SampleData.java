package glm.api;

/** Small count dataset used by the demo and the web sample endpoint. */
public final class SampleData {

    private SampleData() { }

    /** Columns: period index, promotion flag. */
    public static double[][] design() {
        return new double[][] {
            {0, 0}, {1, 1}, {2, 0}, {3, 1}, {4, 0}, {5, 1},
            {6, 0}, {7, 1}, {8, 0}, {9, 1}, {10, 0}, {11, 1},
            {12, 0}, {13, 1}, {14, 0}, {15, 1}
        };
    }

    /** Weekly event counts. */
    public static double[] response() {
        return new double[] {2, 4, 3, 6, 4, 8, 5, 9, 7, 13, 9, 16, 11, 20, 14, 25};
    }
}
