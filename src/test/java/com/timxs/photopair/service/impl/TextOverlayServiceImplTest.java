package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.config.TextOverlayConfig;
import com.timxs.photopair.exception.ConfigurationException;
import com.timxs.photopair.model.TextPlacement;
import com.timxs.photopair.model.TextPosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.*;
import java.awt.font.FontRenderContext;
import java.awt.font.GlyphVector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextOverlayServiceImplTest {

    private static final int WIDTH = 1920;
    private static final int HEIGHT = 1080;

    private final TextOverlayServiceImpl service = new TextOverlayServiceImpl();

    @Mock
    Graphics2D g2d;

    @Mock
    FontMetrics metrics;

    @Test
    void bottomRightAnchorUsesMeasuredWidth() {
        TextPlacement placement = service.place(options(TextPosition.BOTTOM_RIGHT), WIDTH, HEIGHT, 312.5);

        assertThat(placement.x()).isEqualTo(WIDTH - 312.5 - 20);
        assertThat(placement.y()).isEqualTo(HEIGHT - 20);
    }

    @Test
    void topLeftAnchorSitsBelowTheMarginByTheFontSize() {
        TextPlacement placement = service.place(options(TextPosition.TOP_LEFT), WIDTH, HEIGHT, 312.5);

        assertThat(placement.x()).isEqualTo(20);
        assertThat(placement.y()).isEqualTo(48 + 20);
    }

    @Test
    void fontComposesBoldAndItalic() {
        TextOverlayConfig config = enabledConfig();
        config.setBold(true);
        config.setItalic(true);
        config.setSize(36.5);
        TextOptions options = TextOptions.from(config);

        Font font = service.resolveFont(options);

        assertThat(font.isBold()).isTrue();
        assertThat(font.isItalic()).isTrue();
        assertThat(font.getSize2D()).isEqualTo(36.5f);
        assertThat(service.describeFont(options)).isEqualTo("bold italic 36.5px SansSerif");
    }

    @Test
    void plainFontDescriptorHasOnlySizeAndFamily() {
        TextOverlayConfig config = enabledConfig();
        config.setFont("Serif");
        TextOptions options = TextOptions.from(config);

        assertThat(service.resolveFont(options).getStyle()).isEqualTo(Font.PLAIN);
        assertThat(service.describeFont(options)).isEqualTo("48px Serif");
    }

    @Test
    void nonPositiveSizeIsAConfigurationError() {
        TextOverlayConfig config = enabledConfig();
        config.setSize(0);

        assertThatThrownBy(() -> service.resolveFont(TextOptions.from(config)))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void drawFillsTextAtTheComputedAnchor() {
        when(g2d.getFontMetrics(any(Font.class))).thenReturn(metrics);
        when(metrics.stringWidth("John Smith")).thenReturn(250);

        TextPlacement placement = service.draw(g2d, options(TextPosition.BOTTOM_RIGHT), WIDTH, HEIGHT);

        assertThat(placement.x()).isEqualTo(1650);
        verify(g2d).setColor(Color.BLACK);
        verify(g2d).drawString("John Smith", 1650f, 1060f);
        verify(g2d, never()).draw(any(Shape.class));
    }

    @Test
    void strokeIsDrawnBeforeFill() {
        TextOverlayServiceImpl spied = spy(service);
        Font font = mock(Font.class);
        GlyphVector glyphs = mock(GlyphVector.class);
        Shape outline = new Rectangle(1650, 1020, 250, 40);
        doReturn(font).when(spied).resolveFont(any(TextOptions.class));
        when(g2d.getFontMetrics(font)).thenReturn(metrics);
        when(metrics.stringWidth("John Smith")).thenReturn(250);
        when(g2d.getFontRenderContext()).thenReturn(new FontRenderContext(null, true, true));
        when(font.createGlyphVector(any(FontRenderContext.class), eq("John Smith"))).thenReturn(glyphs);
        when(glyphs.getOutline(1650f, 1060f)).thenReturn(outline);

        TextOverlayConfig config = enabledConfig();
        config.setColor("#00F");
        config.setStroke(true);
        config.setStrokeColor("#FF0000");
        config.setStrokeWidth(3.0);

        spied.draw(g2d, TextOptions.from(config).withText("John Smith"), WIDTH, HEIGHT);

        InOrder order = inOrder(g2d);
        order.verify(g2d).setColor(new Color(255, 0, 0));
        order.verify(g2d).setStroke(new BasicStroke(3f));
        order.verify(g2d).draw(outline);
        order.verify(g2d).setColor(new Color(0, 0, 255));
        order.verify(g2d).drawString("John Smith", 1650f, 1060f);
    }

    @Test
    void drawRequiresText() {
        TextOptions options = TextOptions.from(enabledConfig());

        assertThatThrownBy(() -> service.draw(g2d, options, WIDTH, HEIGHT))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidColorsFallBackToTheDefault() {
        assertThat(service.parseColor("#12345", Color.BLACK)).isEqualTo(Color.BLACK);
        assertThat(service.parseColor("#GGGGGG", Color.WHITE)).isEqualTo(Color.WHITE);
        assertThat(service.parseColor(null, Color.BLACK)).isEqualTo(Color.BLACK);
        assertThat(service.parseColor("ff8000", Color.BLACK)).isEqualTo(new Color(255, 128, 0));
    }

    private static TextOverlayConfig enabledConfig() {
        TextOverlayConfig config = new TextOverlayConfig();
        config.setEnabled(true);
        return config;
    }

    private static TextOptions options(TextPosition position) {
        TextOverlayConfig config = enabledConfig();
        config.setPosition(position);
        return TextOptions.from(config).withText("John Smith");
    }
}
