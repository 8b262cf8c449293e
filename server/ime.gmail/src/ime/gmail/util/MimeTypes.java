package ime.gmail.util;

/**
 * Guesses a media type from a file name extension.
 */
public class MimeTypes {
	public static final String DEFAULT_TYPE = "application/octet-stream";

	private static final String[][] TYPES = {
		{ "jpg", "image/jpeg" },
		{ "jpeg", "image/jpeg" },
		{ "gif", "image/gif" },
		{ "png", "image/png" },
		{ "bmp", "image/bmp" },
		{ "svg", "image/svg+xml" },
		{ "txt", "text/plain" },
		{ "csv", "text/csv" },
		{ "htm", "text/html" },
		{ "html", "text/html" },
		{ "xml", "text/xml" },
		{ "ics", "text/calendar" },
		{ "eml", "message/rfc822" },
		{ "pdf", "application/pdf" },
		{ "json", "application/json" },
		{ "zip", "application/zip" },
		{ "gz", "application/gzip" },
		{ "doc", "application/msword" },
		{ "xls", "application/vnd.ms-excel" },
		{ "ppt", "application/vnd.ms-powerpoint" },
		{ "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document" },
		{ "xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet" },
		{ "pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation" },
		{ "mp3", "audio/mpeg" },
		{ "wav", "audio/x-wav" },
		{ "mp4", "video/mp4" }
	};

	private MimeTypes() {
	}

	public static String getMimeType(String name) {
		if (name == null)
			return DEFAULT_TYPE;
		int index = name.lastIndexOf('.');
		if (index < 0 || index == name.length() - 1)
			return DEFAULT_TYPE;
		String ext = name.substring(index + 1).toLowerCase();
		for (String[] type : TYPES) {
			if (type[0].equals(ext))
				return type[1];
		}
		return DEFAULT_TYPE;
	}
}
