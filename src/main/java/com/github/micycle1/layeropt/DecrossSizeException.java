package com.github.micycle1.layeropt;

/**
 * Thrown when a layering is too large for exact crossing minimization and the
 * size guard has not been overridden.
 */
public class DecrossSizeException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final long size;
	private final long limit;

	public DecrossSizeException(long size, long limit) {
		super("layering size " + size + " (sum of squared layer sizes) exceeds the limit of " + limit
				+ "; exact decrossing will likely not complete. Override the size guard to run anyway.");
		this.size = size;
		this.limit = limit;
	}

	public long getSize() {
		return size;
	}

	public long getLimit() {
		return limit;
	}
}
