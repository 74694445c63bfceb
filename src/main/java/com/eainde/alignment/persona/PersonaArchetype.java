package com.eainde.alignment.persona;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * The eight fixed political/values profiles a user can hold.
 *
 * <p>Each archetype combines an economic bloc with a diplomatic orientation.
 * The wire key (e.g. {@code progressive-globalist}) is what the feed UI and
 * the ranking cache use.</p>
 */
public enum PersonaArchetype {

    PROGRESSIVE_GLOBALIST("progressive-globalist", EconomicBloc.PROGRESSIVE, Orientation.GLOBALIST,
            "Values: Left-leaning economics (supports regulation, workers rights, wealth redistribution), "
                    + "Progressive social values (diversity, LGBTQ+ rights, environmental protection), "
                    + "Pro-international cooperation and globalization"),

    PROGRESSIVE_NATIONALIST("progressive-nationalist", EconomicBloc.PROGRESSIVE, Orientation.NATIONALIST,
            "Values: Left-leaning economics (supports regulation, workers rights), "
                    + "Progressive social values (diversity, environmental protection), "
                    + "but prioritizes domestic focus over international involvement"),

    SOCIALIST_LIBERTARIAN("socialist-libertarian", EconomicBloc.SOCIALIST, Orientation.LIBERTARIAN,
            "Values: Left-leaning economics (state intervention, public services), "
                    + "Traditional/conservative social values, Pro-international cooperation"),

    SOCIALIST_NATIONALIST("socialist-nationalist", EconomicBloc.SOCIALIST, Orientation.NATIONALIST,
            "Values: Left-leaning economics (protectionism, state control), "
                    + "Traditional social values, Strong nationalist/isolationist stance"),

    CAPITALIST_GLOBALIST("capitalist-globalist", EconomicBloc.CAPITALIST, Orientation.GLOBALIST,
            "Values: Free market capitalism (deregulation, low taxes), "
                    + "Progressive social values (diversity, innovation), "
                    + "Strong support for global trade and international cooperation"),

    CAPITALIST_NATIONALIST("capitalist-nationalist", EconomicBloc.CAPITALIST, Orientation.NATIONALIST,
            "Values: Free market capitalism domestically, Progressive social values, "
                    + "but \"America First\" approach - prioritizes domestic industry, skeptical of foreign involvement"),

    CONSERVATIVE_GLOBALIST("conservative-globalist", EconomicBloc.CONSERVATIVE, Orientation.GLOBALIST,
            "Values: Free market capitalism, Traditional/conservative social values, "
                    + "Pro-international trade and military alliances (neoconservative)"),

    CONSERVATIVE_NATIONALIST("conservative-nationalist", EconomicBloc.CONSERVATIVE, Orientation.NATIONALIST,
            "Values: Free market capitalism, Traditional/conservative social values, "
                    + "Nationalist approach prioritizing domestic concerns over international involvement");

    public enum EconomicBloc { PROGRESSIVE, SOCIALIST, CAPITALIST, CONSERVATIVE }

    public enum Orientation { GLOBALIST, NATIONALIST, LIBERTARIAN }

    private final String key;
    private final EconomicBloc economicBloc;
    private final Orientation orientation;
    private final String description;

    PersonaArchetype(String key, EconomicBloc economicBloc, Orientation orientation, String description) {
        this.key = key;
        this.economicBloc = economicBloc;
        this.orientation = orientation;
        this.description = description;
    }

    @JsonValue
    public String key() { return key; }
    public EconomicBloc economicBloc() { return economicBloc; }
    public Orientation orientation() { return orientation; }
    public String description() { return description; }

    public boolean isProgressive()  { return economicBloc == EconomicBloc.PROGRESSIVE; }
    public boolean isSocialist()    { return economicBloc == EconomicBloc.SOCIALIST; }
    public boolean isCapitalist()   { return economicBloc == EconomicBloc.CAPITALIST; }
    public boolean isConservative() { return economicBloc == EconomicBloc.CONSERVATIVE; }
    public boolean isGlobalist()    { return orientation == Orientation.GLOBALIST; }
    public boolean isNationalist()  { return orientation == Orientation.NATIONALIST; }

    /**
     * Resolves a wire key such as {@code capitalist-globalist}.
     *
     * @throws IllegalArgumentException if the key names no archetype
     */
    @JsonCreator
    public static PersonaArchetype fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Persona key is mandatory");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown persona: " + key));
    }

    /**
     * Maps a user's position on the three political axes to an archetype.
     *
     * @param economic   negative = left economics
     * @param social     positive = liberal/progressive social values
     * @param diplomatic positive = globalist
     */
    public static PersonaArchetype fromCoordinates(double economic, double social, double diplomatic) {
        boolean leftEconomics = economic < 0;
        boolean liberalSocial = social > 0;
        boolean globalist = diplomatic > 0;

        if (leftEconomics) {
            if (liberalSocial) {
                return globalist ? PROGRESSIVE_GLOBALIST : PROGRESSIVE_NATIONALIST;
            }
            return globalist ? SOCIALIST_LIBERTARIAN : SOCIALIST_NATIONALIST;
        }
        if (liberalSocial) {
            return globalist ? CAPITALIST_GLOBALIST : CAPITALIST_NATIONALIST;
        }
        return globalist ? CONSERVATIVE_GLOBALIST : CONSERVATIVE_NATIONALIST;
    }

    @Override
    public String toString() {
        return key;
    }
}
