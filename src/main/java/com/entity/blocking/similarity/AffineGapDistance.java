package com.entity.blocking.similarity;

/**
 * Affine-gap edit distance normalized by the combined length of both strings.
 *
 * <p>Opening a gap costs {@code gapWeight + spaceWeight}, and each further gap position costs
 * {@code spaceWeight}. Insertions past the end of the shorter string are scaled by
 * {@code abbreviationScale}, so that "inc" is close to "incorporated".</p>
 */
public class AffineGapDistance implements EditDistance {

    private final double matchWeight;
    private final double mismatchWeight;
    private final double gapWeight;
    private final double spaceWeight;
    private final double abbreviationScale;

    public AffineGapDistance() {
        this(0.0, 11.0, 10.0, 7.0, 0.125);
    }

    public AffineGapDistance(double matchWeight, double mismatchWeight, double gapWeight,
                             double spaceWeight, double abbreviationScale) {
        if (matchWeight < 0 || mismatchWeight < 0 || gapWeight < 0 || spaceWeight < 0 || abbreviationScale < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        this.matchWeight = matchWeight;
        this.mismatchWeight = mismatchWeight;
        this.gapWeight = gapWeight;
        this.spaceWeight = spaceWeight;
        this.abbreviationScale = abbreviationScale;
    }

    @Override
    public double distance(String s1, String s2) {
        if (s1 == null || s2 == null || (s1.isEmpty() && s2.isEmpty())) {
            throw new IllegalArgumentException("Affine gap distance needs at least one non-empty string");
        }
        return rawDistance(s1, s2) / (s1.length() + s2.length());
    }

    /**
     * Un-normalized affine-gap distance (Gotoh recurrences, two rows of memory).
     */
    double rawDistance(String s1, String s2) {
        if (s1.equals(s2) && matchWeight <= Math.min(mismatchWeight, gapWeight)) {
            return matchWeight * s1.length();
        }
        // longer string along the row
        String a = s1.length() >= s2.length() ? s1 : s2;
        String b = s1.length() >= s2.length() ? s2 : s1;
        int lengthA = a.length();
        int lengthB = b.length();

        double[] deletion = new double[lengthA + 1];
        double[] current = new double[lengthA + 1];
        double[] previous = new double[lengthA + 1];

        current[0] = 0;
        for (int j = 1; j <= lengthA; j++) {
            current[j] = gapWeight + spaceWeight * j;
            deletion[j] = Double.MAX_VALUE;
        }

        for (int i = 1; i <= lengthB; i++) {
            char charB = b.charAt(i - 1);
            System.arraycopy(current, 0, previous, 0, lengthA + 1);

            current[0] = gapWeight + spaceWeight * i;
            double insertion = Double.MAX_VALUE;

            for (int j = 1; j <= lengthA; j++) {
                char charA = a.charAt(j - 1);

                if (j <= lengthB) {
                    insertion = Math.min(insertion, current[j - 1] + gapWeight) + spaceWeight;
                } else {
                    insertion = Math.min(insertion, current[j - 1] + gapWeight * abbreviationScale)
                            + spaceWeight * abbreviationScale;
                }

                deletion[j] = Math.min(deletion[j], previous[j] + gapWeight) + spaceWeight;

                double match = previous[j - 1] + (charA == charB ? matchWeight : mismatchWeight);

                current[j] = Math.min(Math.min(insertion, deletion[j]), match);
            }
        }
        return current[lengthA];
    }
}
