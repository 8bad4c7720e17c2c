package de.bsommerfeld.sqlcontents.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentModelTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void children_shouldBeEmptyForFilesAndDirectoriesWithoutContent() {
        assertTrue(ContentModel.textFile("a.txt", "x").children().isEmpty());
        assertTrue(ContentModel.directory("dir").children().isEmpty());
        assertFalse(ContentModel.directory("dir").hasContent());
    }

    @Test
    void directoryWithChildren_shouldExposeThemTypedAndAsContent() {
        List<ContentModel> children = List.of(ContentModel.directory("dir/sub"));

        ContentModel dir = ContentModel.directory("dir", children);

        assertEquals(children, dir.children());
        assertEquals(children, dir.content());
        assertEquals(ContentModel.Format.JSON, dir.format());
        assertEquals("dir", dir.name());
    }

    @Test
    void json_shouldCarryChildrenOnlyAsContent() {
        ContentModel dir = ContentModel.directory("dir", List.of(ContentModel.directory("dir/sub")));

        JsonNode json = objectMapper.valueToTree(dir);

        assertFalse(json.has("children"));
        assertEquals("directory", json.get("type").asText());
        assertEquals("dir/sub", json.get("content").get(0).get("path").asText());
    }
}
