package ime.gmail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;

import javax.mail.MessagingException;
import javax.mail.Part;
import javax.mail.internet.MimeUtility;

import org.apache.log4j.Logger;

/**
 * A decoded MIME part carrying an "attachment" disposition. Instances do not
 * refer back to the message they came from.
 */
public class Attachment {
	private static Logger logger = Logger.getLogger(Attachment.class);

	private final String name;
	private final byte[] payload;
	private final int size;

	public Attachment(String name, byte[] payload) {
		this.name = name;
		this.payload = payload == null ? null : payload.clone();
		this.size = kilobytes(payload);
	}

	public Attachment(Part part) throws MessagingException, IOException {
		this(decodeFileName(part.getFileName()), readPayload(part));
	}

	public String getName() {
		return name;
	}

	public byte[] getPayload() {
		return payload == null ? null : payload.clone();
	}

	/**
	 * Payload length in kilobytes, rounded half to even. Payloads under 500
	 * bytes round to 0, so such attachments count as empty and are left out
	 * of a parsed message.
	 */
	public int getSize() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public void save() throws IOException {
		save((File) null);
	}

	public void save(String path) throws IOException {
		save(path == null ? null : new File(path));
	}

	/**
	 * Writes the payload to {@code path}. A directory receives a file named
	 * after the attachment; a null path writes the attachment's name into
	 * the working directory. Existing files are overwritten.
	 *
	 * @throws IOException if the target needs the attachment's name and it has
	 *         none, or the file cannot be written
	 */
	public void save(File path) throws IOException {
		if (name == null && (path == null || path.isDirectory()))
			throw new IOException("Attachment has no name; save it to an explicit file path");

		File target;
		if (path == null)
			target = new File(name);
		else if (path.isDirectory())
			target = new File(path, name);
		else
			target = path;

		FileOutputStream output = null;
		try {
			output = new FileOutputStream(target);
			if (payload != null)
				output.write(payload);
		} finally {
			if (output != null)
				output.close();
		}
		logger.debug("Saved attachment " + name + " to " + target.getPath());
	}

	@Override
	public String toString() {
		return "<Attachment " + name + ">";
	}

	private static int kilobytes(byte[] payload) {
		if (payload == null)
			return 0;
		return (int) Math.rint(payload.length / 1000.0);
	}

	private static String decodeFileName(String fileName) {
		if (fileName == null)
			return null;
		try {
			return MimeUtility.decodeText(fileName);
		} catch (UnsupportedEncodingException e) {
			logger.warn("Cannot decode attachment name " + fileName + ": " + e.getMessage());
			return fileName;
		}
	}

	private static byte[] readPayload(Part part) throws MessagingException, IOException {
		InputStream in = part.getInputStream();
		try {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			byte[] buffer = new byte[4096];
			int len;
			while ((len = in.read(buffer)) > 0) {
				out.write(buffer, 0, len);
			}
			return out.toByteArray();
		} finally {
			in.close();
		}
	}
}
