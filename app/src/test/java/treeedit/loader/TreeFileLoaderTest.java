package treeedit.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import treeedit.model.TreePair;

final class TreeFileLoaderTest {

  @TempDir Path tempDir;

  private final TreeFileLoader loader = new TreeFileLoader();

  @Test
  void loadsParentIndexFile() throws IOException {
    Path file =
        write(
            "pair.txt",
            "# source",
            "3",
            "r -1",
            "x 0",
            "y 0",
            "",
            "# target",
            "3",
            "r -1",
            "y 0",
            "x 0");

    TreePair pair = loader.load(file);

    assertEquals("(r (x) (y))", pair.source().toString());
    assertEquals("(r (y) (x))", pair.target().toString());
  }

  @Test
  void loadsEdgeListSeparatedByMarker() throws IOException {
    Path file =
        write("pair.txt", "# Tree 1", "A B", "A C", "", "B D", "# Tree 2", "A B", "B D");

    TreePair pair = loader.load(file);

    assertEquals("(A (B (D)) (C))", pair.source().toString());
    assertEquals("(A (B (D)))", pair.target().toString());
  }

  @Test
  void loadsEdgeListSeparatedByBlankLine() throws IOException {
    TreePair pair = loader.parse(List.of("", "a b", "a c", "", "", "a"), "inline");

    assertEquals("(a (b) (c))", pair.source().toString());
    assertEquals("(a)", pair.target().toString());
  }

  @Test
  void detectsFormatFromFirstContentLine() {
    assertEquals(
        TreeFileLoader.Format.PARENT_INDEX,
        TreeFileLoader.detectFormat(
            List.of(new TreeFileLoader.Line(1, "# comment"), new TreeFileLoader.Line(2, "4"))));
    assertEquals(
        TreeFileLoader.Format.EDGE_LIST,
        TreeFileLoader.detectFormat(List.of(new TreeFileLoader.Line(1, "a b"))));
    assertEquals(
        TreeFileLoader.Format.EDGE_LIST,
        TreeFileLoader.detectFormat(List.of(new TreeFileLoader.Line(1, "root"))));
    assertNull(TreeFileLoader.detectFormat(List.of(new TreeFileLoader.Line(1, ""))));
  }

  @Test
  void reportsMissingFile() {
    IOException ex = assertThrows(IOException.class, () -> loader.load(tempDir.resolve("nope")));
    assertTrue(ex.getMessage().contains("not found"), ex.getMessage());
  }

  @Test
  void reportsMalformedParentIndexInput() {
    assertMessage(List.of("2", "a -1"), "declares 2 nodes");
    assertMessage(List.of("1", "a -1"), "missing second tree");
    assertMessage(List.of("1", "a -1", "1", "a -1", "b 0"), "unexpected content");
    assertMessage(List.of("1", "a x", "1", "a -1"), "expected 'label parentIndex'");
    assertMessage(List.of("2", "a -1", "b 7", "1", "a -1"), "missing parent");
    assertMessage(List.of("0", "1", "a -1"), "must be positive");
    assertMessage(List.of("2000000000", "a -1", "1", "a -1"), "declares 2000000000 nodes");
    assertMessage(List.of("1", "lambda -1", "1", "a -1"), "reserved");
  }

  @Test
  void reportsMalformedEdgeListInput() {
    assertMessage(List.of("a b", "a c"), "missing second tree");
    assertMessage(List.of("a b c", "", "a"), "expected 'parent child'");
    assertMessage(List.of("a b", "# tree 2", "a", "# Tree 2", "b"), "repeated");
    assertMessage(List.of("a c", "b c", "", "a"), "two parents");
    assertThrows(IOException.class, () -> loader.parse(List.of("# only comments"), "inline"));
  }

  private void assertMessage(List<String> lines, String fragment) {
    IOException ex = assertThrows(IOException.class, () -> loader.parse(lines, "inline"));
    assertTrue(ex.getMessage().contains(fragment), ex.getMessage());
    assertTrue(ex.getMessage().startsWith("inline"), "Message names the input");
  }

  private Path write(String name, String... lines) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, List.of(lines), StandardCharsets.UTF_8);
    return file;
  }
}
