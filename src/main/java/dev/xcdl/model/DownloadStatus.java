package dev.xcdl.model;

/** Activity of the download worker as reported to pollers */
public enum DownloadStatus {
	IDLE,
	STARTING,
	DOWNLOADING,
	PAUSED,
	STOPPED,
	COMPLETE,
	ERROR
}
