package com.eainde.alignment.persona;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.eainde.alignment.persona.PersonaArchetype.*;

/**
 * Static scoring preferences for all eight archetypes.
 *
 * <p>The coefficients are calibrated heuristics. Bounds are validated by the
 * {@link PersonaConfig} records as the table is built, and the table refuses to
 * load unless every archetype has an entry.</p>
 */
@Component
public class PersonaConfigTable {

    private final Map<PersonaArchetype, PersonaConfig> configs;

    public PersonaConfigTable() {
        this(defaults());
    }

    PersonaConfigTable(Map<PersonaArchetype, PersonaConfig> configs) {
        EnumMap<PersonaArchetype, PersonaConfig> copy = new EnumMap<>(PersonaArchetype.class);
        copy.putAll(configs);
        for (PersonaArchetype archetype : PersonaArchetype.values()) {
            PersonaConfig config = copy.get(archetype);
            if (config == null) {
                throw new IllegalStateException("Missing persona config for " + archetype);
            }
            if (config.archetype() != archetype) {
                throw new IllegalStateException("Persona config registered under " + archetype
                        + " belongs to " + config.archetype());
            }
        }
        this.configs = Collections.unmodifiableMap(copy);
    }

    public PersonaConfig get(PersonaArchetype archetype) {
        return configs.get(archetype);
    }

    public Map<PersonaArchetype, PersonaConfig> all() {
        return configs;
    }

    private static Map<PersonaArchetype, PersonaConfig> defaults() {
        Map<PersonaArchetype, PersonaConfig> table = new EnumMap<>(PersonaArchetype.class);

        table.put(PROGRESSIVE_GLOBALIST, new PersonaConfig(PROGRESSIVE_GLOBALIST,
                new PersonaConfig.Donation(0.9, 0.5),
                new PersonaConfig.Sustainability(0.4, 0.4, 0.2, true, 0.9),
                new PersonaConfig.Leadership(List.of("progressive", "liberal", "moderate"), 60),
                new PersonaConfig.News(0.3, 0.6)));

        table.put(PROGRESSIVE_NATIONALIST, new PersonaConfig(PROGRESSIVE_NATIONALIST,
                new PersonaConfig.Donation(0.8, 0.7),
                new PersonaConfig.Sustainability(0.35, 0.35, 0.3, true, 0.8),
                new PersonaConfig.Leadership(List.of("progressive", "liberal", "moderate"), 65),
                new PersonaConfig.News(0.2, 0.5)));

        // left-leaning but skeptical of both parties
        table.put(SOCIALIST_LIBERTARIAN, new PersonaConfig(SOCIALIST_LIBERTARIAN,
                new PersonaConfig.Donation(0.7, 0.8),
                new PersonaConfig.Sustainability(0.3, 0.4, 0.3, true, 0.7),
                new PersonaConfig.Leadership(List.of("progressive", "liberal", "moderate", "libertarian"), 60),
                new PersonaConfig.News(0.0, 0.4)));

        table.put(SOCIALIST_NATIONALIST, new PersonaConfig(SOCIALIST_NATIONALIST,
                new PersonaConfig.Donation(0.6, 0.9),
                new PersonaConfig.Sustainability(0.3, 0.4, 0.3, true, 0.6),
                new PersonaConfig.Leadership(List.of("progressive", "moderate", "conservative"), 65),
                new PersonaConfig.News(-0.2, 0.5)));

        table.put(CAPITALIST_GLOBALIST, new PersonaConfig(CAPITALIST_GLOBALIST,
                new PersonaConfig.Donation(0.3, 0.2),
                new PersonaConfig.Sustainability(0.3, 0.4, 0.3, true, 0.7),
                new PersonaConfig.Leadership(List.of("liberal", "moderate", "conservative"), 55),
                new PersonaConfig.News(0.4, 0.6)));

        table.put(CAPITALIST_NATIONALIST, new PersonaConfig(CAPITALIST_NATIONALIST,
                new PersonaConfig.Donation(0.2, 0.3),
                new PersonaConfig.Sustainability(0.25, 0.35, 0.4, true, 0.5),
                new PersonaConfig.Leadership(List.of("moderate", "conservative", "libertarian"), 60),
                new PersonaConfig.News(0.3, 0.5)));

        // skeptical of ESG regulation: high ratings read as bad
        table.put(CONSERVATIVE_GLOBALIST, new PersonaConfig(CONSERVATIVE_GLOBALIST,
                new PersonaConfig.Donation(-0.8, 0.2),
                new PersonaConfig.Sustainability(0.2, 0.2, 0.6, false, 0.4),
                new PersonaConfig.Leadership(List.of("conservative", "moderate", "libertarian"), 60),
                new PersonaConfig.News(0.2, 0.5)));

        table.put(CONSERVATIVE_NATIONALIST, new PersonaConfig(CONSERVATIVE_NATIONALIST,
                new PersonaConfig.Donation(-0.9, 0.4),
                new PersonaConfig.Sustainability(0.15, 0.25, 0.6, false, 0.3),
                new PersonaConfig.Leadership(List.of("conservative", "moderate"), 65),
                new PersonaConfig.News(0.0, 0.4)));

        return table;
    }
}
