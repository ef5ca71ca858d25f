package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

/**
 * Reads and writes spells as JSON files.
 */
public final class SpellFiles {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpellFiles.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SpellFiles() {
    }

    public static Spell read(Path file) throws SpellFileException {
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), Spell.class);
        } catch (JsonProcessingException e) {
            throw new SpellFileException(file, "Invalid spell file", e);
        } catch (IOException e) {
            throw new SpellFileException(file, "Unable to read spell file", e);
        }
    }

    public static void write(Spell spell, Path file) throws SpellFileException {
        try {
            OBJECT_MAPPER.writeValue(file.toFile(), spell);
            LOGGER.debug("Wrote spell '{}' to {}", spell.getName(), file);
        } catch (IOException e) {
            throw new SpellFileException(file, "Unable to write spell file", e);
        }
    }

    public static String toJson(Spell spell) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(spell);
    }

    public static Spell fromJson(String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(json, Spell.class);
    }

    /**
     * Reads every {@code .json} file directly inside the folder, sorted by spell name.
     */
    public static MutableList<Spell> readFolder(Path folder) throws SpellFileException {
        MutableList<Spell> spells = Lists.mutable.empty();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(folder, "*.json")) {
            for (Path file : files) {
                if (Files.isRegularFile(file)) {
                    spells.add(read(file));
                }
            }
        } catch (IOException e) {
            throw new SpellFileException(folder, "Unable to list spell folder", e);
        }
        spells.sortThis(Comparator.comparing(Spell::getName, String.CASE_INSENSITIVE_ORDER));
        LOGGER.info("Loaded {} spells from {}", spells.size(), folder);
        return spells;
    }
}
