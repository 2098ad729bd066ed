//Next year's population with the component counts that produced it
public record ProjectionStep(Population population, long previousTotal, long maleBirths, long femaleBirths,
                             long maleDeaths, long femaleDeaths, long migrationDistributed, long migrationRequested) {
    public long births() {
        return maleBirths + femaleBirths;
    }

    public long deaths() {
        return maleDeaths + femaleDeaths;
    }

    //Total implied by the components
    public long expectedTotal() {
        return previousTotal + births() - deaths() + migrationDistributed;
    }
}
