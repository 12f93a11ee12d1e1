package stereo.image;

import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

/**
 * Reads and writes the raster images the engine works on. Everything handed
 * out is TYPE_INT_RGB so that channel arithmetic does not depend on the
 * source encoding.
 */
public final class ImageLoader {

	private ImageLoader() {
	}

	public static BufferedImage load(Path path) throws DecodeException {
		BufferedImage image;
		try {
			image = ImageIO.read(path.toFile());
		} catch (IOException e) {
			throw new DecodeException(path, e);
		}
		if (image == null) {
			throw new DecodeException(path, "not a readable raster image");
		}
		return toRgb(image);
	}

	/**
	 * decodes an in-memory stream, e.g. one of the two JPEG streams of an MPO file
	 */
	public static BufferedImage decode(byte[] data, String label) throws DecodeException {
		BufferedImage image;
		try {
			image = ImageIO.read(new ByteArrayInputStream(data));
		} catch (IOException e) {
			throw new DecodeException(label + ": " + e.getMessage());
		}
		if (image == null) {
			throw new DecodeException(label + ": not a readable raster image");
		}
		return toRgb(image);
	}

	public static Dimension readDimension(Path path) throws DecodeException {
		try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
			if (input == null) {
				throw new DecodeException(path, "cannot open image stream");
			}
			Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
			if (!readers.hasNext()) {
				throw new DecodeException(path, "no image reader for this format");
			}
			ImageReader reader = readers.next();
			try {
				reader.setInput(input, true);
				return new Dimension(reader.getWidth(0), reader.getHeight(0));
			} finally {
				reader.dispose();
			}
		} catch (IOException e) {
			throw new DecodeException(path, e);
		}
	}

	public static BufferedImage toRgb(BufferedImage image) {
		if (image.getType() == BufferedImage.TYPE_INT_RGB) {
			return image;
		}
		BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g = rgb.createGraphics();
		try {
			g.drawImage(image, 0, 0, null);
		} finally {
			g.dispose();
		}
		return rgb;
	}

	/**
	 * @param quality JPEG quality between 0 and 1
	 */
	public static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
		Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
		if (!writers.hasNext()) {
			throw new IOException("no JPEG writer available");
		}
		ImageWriter writer = writers.next();
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (ImageOutputStream output = ImageIO.createImageOutputStream(bytes)) {
			writer.setOutput(output);
			ImageWriteParam param = writer.getDefaultWriteParam();
			param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
			param.setCompressionQuality(quality);
			writer.write(null, new IIOImage(toRgb(image), null, null), param);
		} finally {
			writer.dispose();
		}
		return bytes.toByteArray();
	}
}
