package com.latexword.converter.fonts;

import com.latexword.converter.profile.model.FontsConfig;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Platform-specific names for the four CJK font roles.
 *
 * <p>The tables are built once and never modified, so a single instance may
 * be shared between concurrent conversions.</p>
 */
public final class FontRegistry {

    public enum Fontset { MAC, WINDOWS, LINUX }

    public enum Role { SONGTI, HEITI, KAITI, FANGSONG }

    private static final Map<Fontset, Map<Role, String>> FONT_MAPS = Map.of(
        Fontset.MAC, Map.of(
            Role.SONGTI, "STSong",
            Role.HEITI, "Heiti SC",
            Role.KAITI, "Kaiti SC",
            Role.FANGSONG, "STFangsong"),
        Fontset.WINDOWS, Map.of(
            Role.SONGTI, "SimSun",
            Role.HEITI, "SimHei",
            Role.KAITI, "KaiTi",
            Role.FANGSONG, "FangSong"),
        Fontset.LINUX, Map.of(
            Role.SONGTI, "FandolSong",
            Role.HEITI, "FandolHei",
            Role.KAITI, "FandolKai",
            Role.FANGSONG, "FandolFang")
    );

    private static final Map<String, Role> REVERSE_MAP = buildReverseMap();

    private static final Map<Fontset, FontRegistry> INSTANCES = Map.of(
        Fontset.MAC, new FontRegistry(Fontset.MAC),
        Fontset.WINDOWS, new FontRegistry(Fontset.WINDOWS),
        Fontset.LINUX, new FontRegistry(Fontset.LINUX)
    );

    private final Fontset fontset;

    private FontRegistry(Fontset fontset) {
        this.fontset = fontset;
    }

    public static FontRegistry forFontset(Fontset fontset) {
        return INSTANCES.get(fontset == null ? Fontset.MAC : fontset);
    }

    public Fontset getFontset() {
        return fontset;
    }

    public String fontFor(Role role) {
        return FONT_MAPS.get(fontset).get(role);
    }

    /**
     * Translates a concrete CJK font name from any platform to this
     * platform's equivalent, e.g. STSong to SimSun on Windows. Unknown names
     * are returned unchanged.
     */
    public String resolve(String fontName) {
        if (fontName == null) {
            return null;
        }
        Role role = REVERSE_MAP.get(fontName);
        return role == null ? fontName : fontFor(role);
    }

    /** Rewrites every font name of the configuration for this platform. */
    public void localize(FontsConfig fonts) {
        fonts.setBodyEastAsian(resolve(fonts.getBodyEastAsian()));
        fonts.setHeadingEastAsian(resolve(fonts.getHeadingEastAsian()));
        fonts.setCaptionEastAsian(resolve(fonts.getCaptionEastAsian()));
        Map<String, String> commands = new LinkedHashMap<>();
        fonts.getCjkFontCommands().forEach((command, name) -> commands.put(command, resolve(name)));
        fonts.setCjkFontCommands(commands);
    }

    private static Map<String, Role> buildReverseMap() {
        Map<String, Role> reverse = new HashMap<>();
        FONT_MAPS.values().forEach(fonts -> fonts.forEach((role, name) -> reverse.put(name, role)));
        return Map.copyOf(reverse);
    }
}
