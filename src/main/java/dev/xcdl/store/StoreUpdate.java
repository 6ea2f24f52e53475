package dev.xcdl.store;

/** Outcome of a store mutation that may miss its key */
public enum StoreUpdate {
	UPDATED,
	NOT_FOUND,
	WRITE_FAILED
}
