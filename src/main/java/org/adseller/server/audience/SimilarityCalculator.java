package org.adseller.server.audience;

import org.adseller.server.audience.model.Embedding;
import org.adseller.server.audience.model.SimilarityMetric;
import org.adseller.server.log.Logger;
import org.adseller.server.log.LoggerFactory;

import java.util.List;

/**
 * Compares two embeddings and normalizes the outcome to a similarity in [0, 1].
 * <p>
 * Cosine and dot product values are clamped into the range, Euclidean distance d is mapped to 1 / (1 + d).
 */
public class SimilarityCalculator {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityCalculator.class);

    public double similarity(Embedding buyerEmbedding, Embedding productEmbedding) {
        final SimilarityMetric metric = productEmbedding.getModelDescriptor() != null
                ? productEmbedding.getModelDescriptor().getMetric()
                : null;

        return similarity(buyerEmbedding, productEmbedding, metric != null ? metric : SimilarityMetric.COSINE);
    }

    public double similarity(Embedding first, Embedding second, SimilarityMetric metric) {
        final List<Double> v1 = first.getVector();
        final List<Double> v2 = second.getVector();

        if (v1 == null || v2 == null
                || first.effectiveDimension() != second.effectiveDimension()
                || v1.size() != v2.size()) {

            logger.debug("Embedding dimension mismatch: {0} vs {1}",
                    first.effectiveDimension(), second.effectiveDimension());
            return 0.0;
        }

        return switch (metric) {
            case COSINE -> clamp(cosine(v1, v2));
            case DOT -> clamp(dot(v1, v2));
            case L2 -> 1.0 / (1.0 + l2Distance(v1, v2));
        };
    }

    static double cosine(List<Double> v1, List<Double> v2) {
        final double norm1 = Math.sqrt(dot(v1, v1));
        final double norm2 = Math.sqrt(dot(v2, v2));
        if (norm1 == 0 || norm2 == 0) {
            return 0.0;
        }
        return dot(v1, v2) / (norm1 * norm2);
    }

    static double dot(List<Double> v1, List<Double> v2) {
        double result = 0.0;
        for (int i = 0; i < v1.size(); i++) {
            result += value(v1.get(i)) * value(v2.get(i));
        }
        return result;
    }

    static double l2Distance(List<Double> v1, List<Double> v2) {
        double sum = 0.0;
        for (int i = 0; i < v1.size(); i++) {
            final double diff = value(v1.get(i)) - value(v2.get(i));
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static double value(Double value) {
        return value != null ? value : 0.0;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
