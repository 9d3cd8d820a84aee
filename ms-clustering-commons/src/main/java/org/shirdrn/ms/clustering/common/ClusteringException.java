package org.shirdrn.ms.clustering.common;

/**
 * Raised when a clustering run cannot complete: a worker task failed, the caller was
 * interrupted while waiting for workers, or the input could not be read.
 *
 * @author yanjun
 */
public class ClusteringException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ClusteringException(String message) {
		super(message);
	}

	public ClusteringException(String message, Throwable cause) {
		super(message, cause);
	}
}
