//Simulation parameter outside its valid domain, raised before any projection work
public class InvalidParameterException extends IllegalArgumentException {
    private final String parameter;

    public InvalidParameterException(String parameter, Object value, Object lowerBound, Object upperBound) {
        super(parameter + " = " + value + " is outside [" + lowerBound + ", " + upperBound + "]");
        this.parameter = parameter;
    }

    public InvalidParameterException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
