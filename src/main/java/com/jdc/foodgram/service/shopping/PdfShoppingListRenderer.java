package com.jdc.foodgram.service.shopping;

import com.jdc.foodgram.config.ShoppingListProperties;
import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * A4 한 장 이상으로 장바구니 목록을 그린다.
 * 상단 제목 띠, 날짜/사용자 줄, 번호가 붙은 행(짝수 행 배경), 오른쪽 정렬 수량, 페이지마다 푸터, 마지막에 총 개수.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfShoppingListRenderer implements ShoppingListRenderer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private static final Color ACCENT = new Color(0x4A, 0x90, 0xD9);
    private static final Color MUTED = new Color(0x66, 0x66, 0x66);
    private static final Color DIVIDER = new Color(0xE0, 0xE0, 0xE0);
    private static final Color ROW_BACKGROUND = new Color(0xF5, 0xF5, 0xF5);
    private static final Color BODY = new Color(0x33, 0x33, 0x33);
    private static final Color FOOTER = new Color(0x99, 0x99, 0x99);

    private static final float MARGIN = 50;
    private static final float ROW_HEIGHT = 30;
    private static final float BOTTOM_LIMIT = 80;

    private final ShoppingListProperties properties;

    @Override
    public byte[] render(String username, LocalDate date, List<ShoppingListItemDto> items) {
        try (PDDocument document = new PDDocument()) {
            PDFont regular = loadFont(document, properties.getFontPath(), Standard14Fonts.FontName.HELVETICA);
            PDFont bold = loadFont(document, properties.getBoldFontPath(), Standard14Fonts.FontName.HELVETICA_BOLD);

            PDRectangle size = PDRectangle.A4;
            float width = size.getWidth();
            float height = size.getHeight();

            PDPage page = new PDPage(size);
            document.addPage(page);
            PDPageContentStream cs = new PDPageContentStream(document, page);

            // 제목 띠
            fillRect(cs, ACCENT, 0, height - 80, width, 80);
            drawCentered(cs, bold, 28, Color.WHITE, properties.getTitle(), width / 2, height - 55);

            drawText(cs, regular, 10, MUTED, "Date: " + date.format(DATE_FORMAT), MARGIN, height - 110);
            drawText(cs, regular, 10, MUTED, "User: " + username, MARGIN, height - 125);
            drawLine(cs, DIVIDER, 1, MARGIN, height - 140, width - MARGIN);

            float y = height - 170;
            int index = 1;
            for (ShoppingListItemDto item : items) {
                if (index % 2 == 0) {
                    fillRect(cs, ROW_BACKGROUND, MARGIN, y - 5, width - 2 * MARGIN, ROW_HEIGHT);
                }
                drawText(cs, bold, 12, ACCENT, index + ".", 60, y + 5);
                drawText(cs, regular, 12, BODY, capitalize(item.getName()), 90, y + 5);
                String amount = item.getTotalAmount() + " " + item.getMeasurementUnit();
                drawRight(cs, bold, 12, BODY, amount, width - 60, y + 5);

                y -= ROW_HEIGHT;
                index++;

                if (y < BOTTOM_LIMIT) {
                    drawFooter(cs, regular, width);
                    cs.close();
                    page = new PDPage(size);
                    document.addPage(page);
                    cs = new PDPageContentStream(document, page);
                    y = height - MARGIN;
                }
            }

            drawLine(cs, ACCENT, 2, MARGIN, y, width - MARGIN);
            drawText(cs, bold, 14, BODY, "Total items: " + items.size(), 60, y - 25);
            drawFooter(cs, regular, width);
            cs.close();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new CustomException(ErrorCode.DOCUMENT_RENDER_FAILED, "PDF 생성 실패: " + e.getMessage());
        }
    }

    @Override
    public String contentType() {
        return MediaType.APPLICATION_PDF_VALUE;
    }

    private PDFont loadFont(PDDocument document, String path, Standard14Fonts.FontName fallback) throws IOException {
        if (StringUtils.hasText(path)) {
            File file = new File(path);
            if (file.isFile()) {
                return PDType0Font.load(document, file);
            }
            log.warn("폰트 파일을 찾을 수 없어 기본 폰트를 사용합니다: {}", path);
        }
        return new PDType1Font(fallback);
    }

    private void drawFooter(PDPageContentStream cs, PDFont font, float width) throws IOException {
        drawCentered(cs, font, 9, FOOTER, properties.getFooter(), width / 2, 30);
    }

    private void drawText(PDPageContentStream cs, PDFont font, float fontSize, Color color,
                          String text, float x, float y) throws IOException {
        cs.beginText();
        cs.setNonStrokingColor(color);
        cs.setFont(font, fontSize);
        cs.newLineAtOffset(x, y);
        cs.showText(printable(font, text));
        cs.endText();
    }

    private void drawCentered(PDPageContentStream cs, PDFont font, float fontSize, Color color,
                              String text, float centerX, float y) throws IOException {
        String safe = printable(font, text);
        drawText(cs, font, fontSize, color, safe, centerX - textWidth(font, fontSize, safe) / 2, y);
    }

    private void drawRight(PDPageContentStream cs, PDFont font, float fontSize, Color color,
                           String text, float rightX, float y) throws IOException {
        String safe = printable(font, text);
        drawText(cs, font, fontSize, color, safe, rightX - textWidth(font, fontSize, safe), y);
    }

    private void fillRect(PDPageContentStream cs, Color color, float x, float y, float w, float h) throws IOException {
        cs.setNonStrokingColor(color);
        cs.addRect(x, y, w, h);
        cs.fill();
    }

    private void drawLine(PDPageContentStream cs, Color color, float lineWidth, float fromX, float y, float toX) throws IOException {
        cs.setStrokingColor(color);
        cs.setLineWidth(lineWidth);
        cs.moveTo(fromX, y);
        cs.lineTo(toX, y);
        cs.stroke();
    }

    private float textWidth(PDFont font, float fontSize, String text) throws IOException {
        return font.getStringWidth(text) / 1000 * fontSize;
    }

    /**
     * 글꼴이 인코딩하지 못하는 문자는 '?'로 바꾼다. 기본 Helvetica는 WinAnsi 범위만 지원한다.
     */
    static String printable(PDFont font, String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            try {
                font.encode(ch);
                sb.append(ch);
            } catch (IllegalArgumentException | IOException e) {
                sb.append('?');
            }
        });
        return sb.toString();
    }

    static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
