import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Cross-checks each projection step against the population balancing equation
public class BalanceValidator {
    private static final Logger logger = LoggerFactory.getLogger(BalanceValidator.class);

    public static final long DEFAULT_TOLERANCE = 1;

    private final long tolerance;

    public BalanceValidator() {
        this(DEFAULT_TOLERANCE);
    }

    public BalanceValidator(long tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must be non-negative, got " + tolerance);
        }
        this.tolerance = tolerance;
    }

    //Never throws, discrepancies beyond tolerance are logged and reported
    public BalanceCheck validate(ProjectionStep step) {
        long expectedTotal = step.expectedTotal();
        long actualTotal = step.population().getTotalPopulation();
        BalanceCheck check = new BalanceCheck(step.population().getYear(), expectedTotal, actualTotal, tolerance);
        if (!check.isBalanced()) {
            logger.warn("Population balance off by {} in {}: expected {} = {} + {} births - {} deaths + {} migrants, projected {}",
                    check.discrepancy(), check.year(), expectedTotal, step.previousTotal(), step.births(), step.deaths(),
                    step.migrationDistributed(), actualTotal);
        }
        return check;
    }

    public long getTolerance() {
        return tolerance;
    }

    public record BalanceCheck(int year, long expectedTotal, long actualTotal, long tolerance) {
        public long discrepancy() {
            return actualTotal - expectedTotal;
        }

        public boolean isBalanced() {
            return Math.abs(discrepancy()) <= tolerance;
        }
    }
}
