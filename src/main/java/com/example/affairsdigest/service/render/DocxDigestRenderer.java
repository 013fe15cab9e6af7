/**
 * Renders the combined digest as a Word document, one styled paragraph per block in input order.
 * A heading that carries an image reference is followed by the image, centred on its own line,
 * and closes its section with a continuous section break.
 */

package com.example.affairsdigest.service.render;

import com.example.affairsdigest.exception.FetchException;
import com.example.affairsdigest.model.ContentBlock;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Borders;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STSectionMark;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

public class DocxDigestRenderer {
    private static final DateTimeFormatter TITLE_DATE = DateTimeFormatter.ofPattern("dd MMMM yyyy", Locale.ENGLISH);
    private static final int TWIPS_PER_POINT = 20;
    private static final int TWIPS_PER_INCH = 1440;
    private static final double IMAGE_WIDTH_POINTS = 2.5 * 72;
    private static final double IMAGE_HEIGHT_POINTS = 1.875 * 72;
    static final String HEADING_4_STYLE = "Heading4";

    private final ImageFetcher imageFetcher;
    private final ImageNormalizer imageNormalizer;
    private final Logger logger;

    public DocxDigestRenderer(ImageFetcher imageFetcher, ImageNormalizer imageNormalizer, Logger logger) {
        this.imageFetcher = imageFetcher;
        this.imageNormalizer = imageNormalizer;
        this.logger = logger;
    }

    public void render(List<ContentBlock> blocks, LocalDate date, OutputStream out) throws IOException {
        try (XWPFDocument document = new XWPFDocument()) {
            applyMargins(bodySection(document));
            addHeading4Style(document);
            addTitle(document, "Current Affairs - " + TITLE_DATE.format(date));

            int images = 0;
            for (ContentBlock block : blocks) {
                switch (block.getKind()) {
                    case HEADING:
                        addText(document, block.getText(), ParagraphRole.HEADING);
                        if (block.getImageRef().isPresent()) {
                            if (addImage(document, block.getImageRef().get())) {
                                images++;
                            }
                            addContinuousSectionBreak(document);
                        }
                        break;
                    case PARAGRAPH:
                        addText(document, block.getText(), ParagraphRole.BODY).setBorderBottom(Borders.SINGLE);
                        break;
                    case SUB_HEADING:
                        addText(document, block.getText(), ParagraphRole.SUB_HEADING);
                        break;
                    case SUB_SUB_HEADING:
                        addText(document, block.getText(), ParagraphRole.SUB_SUB_HEADING).setStyle(HEADING_4_STYLE);
                        break;
                    case BULLET_ITEM:
                        addText(document, "• " + block.getText(), ParagraphRole.LIST_ITEM);
                        break;
                    case NUMBERED_ITEM:
                        addText(document, block.getOrdinal().getAsInt() + ". " + block.getText(), ParagraphRole.LIST_ITEM);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown block kind " + block.getKind());
                }
            }
            document.write(out);
            logger.info("Rendered " + blocks.size() + " blocks and " + images + " images");
        }
    }

    private static CTSectPr bodySection(XWPFDocument document) {
        return document.getDocument().getBody().isSetSectPr()
                ? document.getDocument().getBody().getSectPr()
                : document.getDocument().getBody().addNewSectPr();
    }

    private static void applyMargins(CTSectPr section) {
        CTPageMar margins = section.isSetPgMar() ? section.getPgMar() : section.addNewPgMar();
        margins.setLeft(BigInteger.valueOf(cmToTwips(2.0)));
        margins.setRight(BigInteger.valueOf(cmToTwips(2.0)));
        margins.setTop(BigInteger.valueOf(cmToTwips(1.5)));
        margins.setBottom(BigInteger.valueOf(cmToTwips(1.5)));
    }

    // the ended section carries its own properties, so it repeats the page margins
    private void addContinuousSectionBreak(XWPFDocument document) {
        XWPFParagraph paragraph = document.createParagraph();
        CTSectPr section = paragraph.getCTP().addNewPPr().addNewSectPr();
        section.addNewType().setVal(STSectionMark.CONTINUOUS);
        applyMargins(section);
    }

    private void addHeading4Style(XWPFDocument document) {
        CTStyle style = CTStyle.Factory.newInstance();
        style.setStyleId(HEADING_4_STYLE);
        style.setType(STStyleType.PARAGRAPH);
        style.addNewName().setVal("heading 4");
        style.addNewQFormat();
        style.addNewPPr().addNewOutlineLvl().setVal(BigInteger.valueOf(3));
        document.createStyles().addStyle(new XWPFStyle(style));
    }

    private void addTitle(XWPFDocument document, String text) {
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        paragraph.setSpacingAfter(20 * TWIPS_PER_POINT);
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        run.setFontFamily("Calibri");
        run.setFontSize(22);
        run.setBold(true);
        run.setColor("0066CC");
        run.setUnderline(UnderlinePatterns.SINGLE);
    }

    private XWPFParagraph addText(XWPFDocument document, String text, ParagraphRole role) {
        XWPFParagraph paragraph = document.createParagraph();
        role.applyTo(paragraph);
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        role.applyTo(run);
        return paragraph;
    }

    private boolean addImage(XWPFDocument document, String imageUrl) {
        Optional<byte[]> image;
        try {
            image = imageNormalizer.normalize(imageFetcher.fetch(imageUrl), imageUrl);
        } catch (FetchException e) {
            logger.warning("Skipping image: " + e.getMessage());
            return false;
        }
        if (image.isEmpty()) {
            return false;
        }
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        paragraph.setSpacingBefore(6 * TWIPS_PER_POINT);
        paragraph.setSpacingAfter(12 * TWIPS_PER_POINT);
        try {
            paragraph.createRun().addPicture(new ByteArrayInputStream(image.get()), XWPFDocument.PICTURE_TYPE_PNG,
                    "featured.png", Units.toEMU(IMAGE_WIDTH_POINTS), Units.toEMU(IMAGE_HEIGHT_POINTS));
            return true;
        } catch (InvalidFormatException | IOException e) {
            logger.warning("Failed to embed image from " + imageUrl + ": " + e.getMessage());
            document.removeBodyElement(document.getPosOfParagraph(paragraph));
            return false;
        }
    }

    private static int cmToTwips(double centimetres) {
        return (int) Math.round(centimetres / 2.54 * TWIPS_PER_INCH);
    }

    private enum ParagraphRole {
        HEADING("Arial", 16, true, false, "333333", 12, 8, TWIPS_PER_INCH / 4, 0, 0),
        SUB_HEADING("Arial", 14, true, true, "00994C", 10, 6, 0, 0, 0),
        SUB_SUB_HEADING("Arial", 12, true, false, "666666", 8, 4, 0, 0, 0),
        BODY("Georgia", 12, false, false, "212121", 0, 8, 0, TWIPS_PER_INCH / 2, 1.15),
        LIST_ITEM("Georgia", 12, false, false, "424242", 0, 4, TWIPS_PER_INCH * 3 / 4, -TWIPS_PER_INCH / 4, 0);

        private final String font;
        private final int size;
        private final boolean bold;
        private final boolean italic;
        private final String color;
        private final int spaceBefore;
        private final int spaceAfter;
        private final int leftIndent;
        private final int firstLineIndent;
        private final double lineSpacing;

        ParagraphRole(String font, int size, boolean bold, boolean italic, String color,
                      int spaceBefore, int spaceAfter, int leftIndent, int firstLineIndent, double lineSpacing) {
            this.font = font;
            this.size = size;
            this.bold = bold;
            this.italic = italic;
            this.color = color;
            this.spaceBefore = spaceBefore;
            this.spaceAfter = spaceAfter;
            this.leftIndent = leftIndent;
            this.firstLineIndent = firstLineIndent;
            this.lineSpacing = lineSpacing;
        }

        void applyTo(XWPFParagraph paragraph) {
            if (spaceBefore > 0) {
                paragraph.setSpacingBefore(spaceBefore * TWIPS_PER_POINT);
            }
            paragraph.setSpacingAfter(spaceAfter * TWIPS_PER_POINT);
            if (leftIndent > 0) {
                paragraph.setIndentationLeft(leftIndent);
            }
            if (firstLineIndent > 0) {
                paragraph.setIndentationFirstLine(firstLineIndent);
            } else if (firstLineIndent < 0) {
                paragraph.setIndentationHanging(-firstLineIndent);
            }
            if (lineSpacing > 0) {
                paragraph.setSpacingBetween(lineSpacing);
            }
        }

        void applyTo(XWPFRun run) {
            run.setFontFamily(font);
            run.setFontSize(size);
            run.setBold(bold);
            run.setItalic(italic);
            run.setColor(color);
        }
    }
}
