package com.example.mediacache.loadgen;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Produces request locators for load runs. Video popularity follows a Zipf distribution
 * over {@code universe} ranks, and each draw renders the video through a random one of the
 * URL shapes the cache treats as equivalent. A {@code scanRatio} share of draws are
 * one-off non-video URLs that never repeat.
 */
public class LocatorWorkload {

    public enum UrlShape {
        WATCH("https://www.youtube.com/watch?v=%s"),
        SHORT("https://youtu.be/%s"),
        EMBED("https://www.youtube.com/embed/%s"),
        LEGACY("https://www.youtube.com/v/%s");

        private final String template;

        UrlShape(String template) {
            this.template = template;
        }

        public String render(String videoId) {
            return String.format(template, videoId);
        }
    }

    private final RandomGenerator random;
    private final ZipfDistribution zipf;
    private final double scanRatio;
    private long scanCounter;

    public LocatorWorkload(int universe, double exponent, double scanRatio, long seed) {
        if (scanRatio < 0.0 || scanRatio > 1.0) {
            throw new IllegalArgumentException("scanRatio must be within [0, 1], was " + scanRatio);
        }
        this.random = new Well19937c(seed);
        this.zipf = new ZipfDistribution(random, universe, exponent);
        this.scanRatio = scanRatio;
    }

    public synchronized String next() {
        if (random.nextDouble() < scanRatio) {
            return "https://media.example.org/clip/" + (scanCounter++);
        }
        int rank = zipf.sample();
        UrlShape[] shapes = UrlShape.values();
        return shapes[random.nextInt(shapes.length)].render(videoId(rank));
    }

    /**
     * Eleven-character id for a popularity rank, shaped like a real video id.
     */
    public static String videoId(int rank) {
        return String.format("vid%08d", rank);
    }
}
