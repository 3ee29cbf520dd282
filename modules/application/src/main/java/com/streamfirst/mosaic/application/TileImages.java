package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.Rgb;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

/**
 * Raster helpers shared by indexing and composition. All images handed out are
 * {@link BufferedImage#TYPE_INT_RGB}; alpha is dropped.
 */
public final class TileImages {

  private TileImages() {}

  /**
   * Decodes an encoded image into an RGB raster.
   *
   * @throws IOException if the format is not recognized or the data is corrupt
   */
  public static BufferedImage decode(byte[] data) throws IOException {
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
    if (image == null) {
      throw new IOException("Unsupported image format");
    }
    return toRgb(image);
  }

  /**
   * Reads only the header of an encoded image.
   *
   * @throws IOException if the format is not recognized
   */
  public static Dimension readDimensions(byte[] data) throws IOException {
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
      Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
      if (!readers.hasNext()) {
        throw new IOException("Unsupported image format");
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(in, true, true);
        return new Dimension(reader.getWidth(0), reader.getHeight(0));
      } finally {
        reader.dispose();
      }
    }
  }

  public static BufferedImage toRgb(BufferedImage source) {
    if (source.getType() == BufferedImage.TYPE_INT_RGB) {
      return source;
    }
    int width = source.getWidth();
    int height = source.getHeight();
    BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    int[] row = new int[width];
    for (int y = 0; y < height; y++) {
      source.getRGB(0, y, width, 1, row, 0, width);
      rgb.setRGB(0, y, width, 1, row, 0, width);
    }
    return rgb;
  }

  /**
   * Normalizes an image to a {@code size x size} tile: shrink to fit inside the square keeping the
   * aspect ratio, then stretch to exactly the square.
   */
  public static BufferedImage thumbnail(BufferedImage source, int size) {
    int width = source.getWidth();
    int height = source.getHeight();
    if (width > size || height > size) {
      double scale = Math.min((double) size / width, (double) size / height);
      width = Math.max(1, (int) Math.round(width * scale));
      height = Math.max(1, (int) Math.round(height * scale));
    }
    return resize(resize(source, width, height), size, size);
  }

  /**
   * Resamples to exactly {@code width x height}. Large reductions go through repeated halving so
   * that every source pixel contributes.
   */
  public static BufferedImage resize(BufferedImage source, int width, int height) {
    BufferedImage current = toRgb(source);
    if (current.getWidth() == width && current.getHeight() == height) {
      return current;
    }
    int w = current.getWidth();
    int h = current.getHeight();
    while (true) {
      int nextW = w >= width * 2 ? w / 2 : w;
      int nextH = h >= height * 2 ? h / 2 : h;
      if (nextW == w && nextH == h) {
        break;
      }
      current = draw(current, nextW, nextH, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      w = nextW;
      h = nextH;
    }
    if (w == width && h == height) {
      return current;
    }
    return draw(current, width, height, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
  }

  private static BufferedImage draw(BufferedImage source, int width, int height, Object interpolation) {
    BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = scaled.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(source, 0, 0, width, height, null);
    } finally {
      g.dispose();
    }
    return scaled;
  }

  public static int[] pixels(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    return image.getRGB(0, 0, width, height, null, 0, width);
  }

  public static Rgb averageColor(BufferedImage image) {
    return averageColor(pixels(image), image.getWidth(), 0, 0, image.getWidth(), image.getHeight());
  }

  /**
   * Exact area average of a rectangle of packed RGB pixels, each channel rounded to the nearest
   * integer.
   *
   * @param pixels packed pixels in row-major order
   * @param stride pixels per row in {@code pixels}
   */
  public static Rgb averageColor(int[] pixels, int stride, int x0, int y0, int width, int height) {
    long sumR = 0;
    long sumG = 0;
    long sumB = 0;
    for (int y = y0; y < y0 + height; y++) {
      int offset = y * stride;
      for (int x = x0; x < x0 + width; x++) {
        int p = pixels[offset + x];
        sumR += (p >> 16) & 0xFF;
        sumG += (p >> 8) & 0xFF;
        sumB += p & 0xFF;
      }
    }
    long count = (long) width * height;
    long half = count / 2;
    return new Rgb((int) ((sumR + half) / count), (int) ((sumG + half) / count), (int) ((sumB + half) / count));
  }

  /**
   * Encodes a raster as baseline JPEG.
   *
   * @param quality compression quality between 0 and 1
   */
  public static byte[] encodeJpeg(BufferedImage image, float quality) {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IllegalStateException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(ios);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(quality);
      writer.write(null, new IIOImage(toRgb(image), null, null), param);
    } catch (IOException e) {
      throw new UncheckedIOException("JPEG encoding failed", e);
    } finally {
      writer.dispose();
    }
    return out.toByteArray();
  }

  public static BufferedImage solid(int width, int height, Rgb color) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    int[] row = new int[width];
    Arrays.fill(row, color.packed());
    for (int y = 0; y < height; y++) {
      image.setRGB(0, y, width, 1, row, 0, width);
    }
    return image;
  }
}
