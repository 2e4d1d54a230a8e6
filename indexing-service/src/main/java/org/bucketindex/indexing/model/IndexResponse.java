package org.bucketindex.indexing.model;

import org.bucketindex.indexing.service.IndexReport;

public record IndexResponse(
		String status,
		IndexReport report,
		String error
) {
	public static IndexResponse completed(IndexReport report) {
		return new IndexResponse("completed", report, null);
	}

	public static IndexResponse busy(String message) {
		return new IndexResponse("busy", null, message);
	}

	public static IndexResponse failed(String message) {
		return new IndexResponse("failed", null, message);
	}
}
