package edu.harvard.hms.dbmi.avillach.tsformat.exception;

public class SeriesLoadException extends RuntimeException {

	private static final long serialVersionUID = -6093127740581236284L;

	private final String path;

	public SeriesLoadException(String path, Throwable cause) {
		super("Unable to load time series file " + path + ": " + cause.getMessage(), cause);
		this.path = path;
	}

	public SeriesLoadException(String path, String reason) {
		super("Unable to load time series file " + path + ": " + reason);
		this.path = path;
	}

	public String getPath() {
		return path;
	}
}
