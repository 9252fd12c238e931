package org.springaicommunity.github.extractor;

import java.util.List;

/**
 * Append-only store of job lifecycle records. Records are never edited or removed.
 */
public interface AuditLog {

	/**
	 * Append one record. Safe to call from concurrently finishing jobs.
	 */
	void append(AuditEntry entry);

	/**
	 * The most recent {@code limit} records, oldest first.
	 */
	List<AuditEntry> tail(int limit);

}
