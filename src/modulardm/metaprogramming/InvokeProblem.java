package modulardm.metaprogramming;

/**
 * Thrown when a reflective operation on a control class fails for reasons
 * other than the control's own code throwing.
 */
@SuppressWarnings("serial")
public class InvokeProblem extends RuntimeException {

	public InvokeProblem(Throwable cause) {
		super(cause);
	}

	public InvokeProblem(String message, Throwable cause) {
		super(message, cause);
	}
}
