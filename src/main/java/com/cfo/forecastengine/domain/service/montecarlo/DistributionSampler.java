package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.DriverSpec;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.random.RandomGenerator;

@Component
public class DistributionSampler {

    public double sample(DriverSpec spec, RandomGenerator rng) {
        validateSpec(spec);

        double raw = switch (spec.getDistribution()) {
            case NORMAL -> sampleNormal(spec.getMean(), spec.getStdDev(), rng);
            case LOGNORMAL -> sampleLognormal(spec.getMean(), spec.getStdDev(), rng);
            case TRIANGULAR -> sampleTriangular(spec.getMin(), spec.getMean(), spec.getMax(), rng);
        };
        return clamp(raw, spec.getMin(), spec.getMax());
    }

    public Map<String, Double> sampleAll(Collection<DriverSpec> drivers, RandomGenerator rng) {
        Map<String, Double> values = new LinkedHashMap<>(drivers.size() * 2);
        for (DriverSpec spec : drivers) {
            values.put(spec.getId(), sample(spec, rng));
        }
        return values;
    }

    double sampleNormal(double mean, double stdDev, RandomGenerator rng) {
        if (stdDev == 0.0) return mean;
        return mean + stdDev * rng.nextGaussian();
    }

    double sampleLognormal(double mean, double stdDev, RandomGenerator rng) {
        if (stdDev == 0.0) return mean;
        double cv = stdDev / mean;
        double sigmaSq = Math.log(1.0 + cv * cv);
        double mu = Math.log(mean) - 0.5 * sigmaSq;
        return Math.exp(mu + Math.sqrt(sigmaSq) * rng.nextGaussian());
    }

    double sampleTriangular(double min, double mode, double max, RandomGenerator rng) {
        double range = max - min;
        if (range == 0.0) return min;

        double u = rng.nextDouble();
        double modeCdf = (mode - min) / range;
        if (u < modeCdf) {
            return min + Math.sqrt(u * range * (mode - min));
        }
        return max - Math.sqrt((1.0 - u) * range * (max - mode));
    }

    private double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    private void validateSpec(DriverSpec spec) {
        if (spec.getDistribution() == null) {
            throw new IllegalArgumentException("분포 유형이 없습니다: driver=" + spec.getId());
        }
        if (spec.getMin() > spec.getMax()) {
            throw new IllegalArgumentException("min이 max보다 큽니다: driver=" + spec.getId());
        }
        if (spec.getStdDev() < 0) {
            throw new IllegalArgumentException("stdDev는 음수일 수 없습니다: driver=" + spec.getId());
        }
    }
}
