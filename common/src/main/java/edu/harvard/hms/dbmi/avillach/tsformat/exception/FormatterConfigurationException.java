package edu.harvard.hms.dbmi.avillach.tsformat.exception;

/**
 * Thrown when the input dataset or the formatter hyperparameters do not describe a loadable
 * time series layout: no main resource, no csv file name column, or a file name column whose
 * foreign key does not lead to a declared base location.
 *
 * The message always names the offending resource and/or column.
 */
public class FormatterConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 3718841957204652213L;

	public FormatterConfigurationException(String message) {
		super(message);
	}
}
