/**
 * Fiscal indicators for one projected year, amounts in EUR at the year's prices.
 *
 * <p>{@code laborUtilizationRate} divides the whole workforce, including people still working past
 * retirement age, by the working-age population only. It can therefore exceed 1.0.
 */
public record EconomicMetrics(double actualWorkforce, double laborUtilizationRate, double actualPensioners,
                              double totalContributions, double totalPensionPayments,
                              double ssBalance, double ssDeficit, double ssBalancePerWorker,
                              double totalHealthcareCost, double publicHealthcareCost, double healthcareCostPerWorker,
                              double totalBurdenPerWorker, double gdpProxy, double sustainabilityIndex) {
}
