package com.cliffc.untangle;

import com.cliffc.untangle.eval.Evaluator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class TestUntangle {
  private static final ObjectMapper JSON = new ObjectMapper();
  static final String[] DATA = { "0", "0", "a", "b", "c", "ab+c&", "abc^^~", "ab>ca!" };
  static final String INPUT =
    "{\"kstart\":2,\"ostart\":5,\"estart\":5,\"nstart\":5,\"numroots\":8,"+
    "\"knames\":[\"x\",\"y\",\"z\"],\"onames\":[],\"enames\":[],"+
    "\"rnames\":[\"f\",\"g\",\"h\"],"+
    "\"data\":[\"0\",\"0\",\"a\",\"b\",\"c\",\"ab+c&\",\"abc^^~\",\"ab>ca!\"]}";

  @Rule public TemporaryFolder _tmp = new TemporaryFolder();

  private String _out;
  private int run( String... args ) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    int rc = Untangle.run(args,new PrintStream(bytes,true,StandardCharsets.UTF_8));
    _out = bytes.toString(StandardCharsets.UTF_8);
    return rc;
  }
  private JsonNode outJson() throws IOException { return JSON.readTree(_out); }

  @Test public void testHelp() {
    assertEquals(0,run("--help"));
    assertTrue(_out.startsWith("usage:"));
  }

  @Test public void testUsageErrors() throws IOException {
    assertEquals(1,run("--bogus","a","b"));
    assertEquals("unknown option",outJson().get("error").asText());
    assertEquals("--bogus",outJson().get("option").asText());

    assertEquals(1,run("only.dat"));
    assertEquals("expected an output and an input file",outJson().get("error").asText());

    assertEquals(1,run("--maxnode=lots","a","b"));
    assertEquals("bad numeric option",outJson().get("error").asText());
  }

  @Test public void testMissingInput() throws IOException {
    Path out = _tmp.getRoot().toPath().resolve("out.dat");
    Path in  = _tmp.getRoot().toPath().resolve("missing.json");
    assertEquals(1,run("--quiet=0",out.toString(),in.toString()));
    assertEquals("input file not found",outJson().get("error").asText());
    assertFalse(Files.exists(out));
  }

  @Test public void testBuildAndDump() throws IOException {
    Path in   = _tmp.newFile("in.json").toPath();
    Files.writeString(in,INPUT);
    Path dat  = _tmp.getRoot().toPath().resolve("tree.dat");
    Path dump = _tmp.getRoot().toPath().resolve("dump.json");

    assertEquals(0,run("--quiet=0","--timer=0","--paranoid",dat.toString(),in.toString()));
    JsonNode info = outJson();
    assertEquals(dat.toString(),info.get("filename").asText());
    assertEquals(5,info.get("nstart").asInt());
    assertEquals(8,info.get("numroots").asInt());
    assertEquals(Files.size(dat),info.get("size").asLong());
    assertEquals(Context.MAGICMASK_PARANOID,info.get("flags").asInt() & Context.MAGICMASK_PARANOID);

    // The output is never silently replaced
    assertEquals(1,run("--quiet=0",dat.toString(),in.toString()));
    assertEquals("output file exists, use --force to overwrite",outJson().get("error").asText());
    assertEquals(0,run("--quiet=0","--force","--timer=0",dat.toString(),in.toString()));

    assertEquals(0,run("--quiet=0","--dump",dump.toString(),dat.toString()));
    JsonNode j = JSON.readTree(dump.toFile());
    assertEquals("y",j.get("knames").get(1).asText());
    assertEquals("h",j.get("rnames").get(2).asText());
    JsonNode data = j.get("data");
    assertEquals(DATA.length,data.size());
    long[] keys = Evaluator.laneKeys(3,0);
    for( int i=0; i<DATA.length; i++ )
      assertEquals(DATA[i],
                   Evaluator.evalString(DATA[i],2,5,keys,null),
                   Evaluator.evalString(data.get(i).asText(),2,5,keys,null));
  }

  @Test public void testDumpOfGarbage() throws IOException {
    Path dat = _tmp.newFile("junk.dat").toPath();
    Files.write(dat,new byte[200]);
    Path dump = _tmp.getRoot().toPath().resolve("dump.json");
    assertEquals(1,run("--quiet=0","--dump",dump.toString(),dat.toString()));
    assertEquals("db magic",outJson().get("error").asText());
  }

  @Test public void testSyntaxError() throws IOException {
    Path in = _tmp.newFile("in.json").toPath();
    Files.writeString(in,INPUT.replace("ab>ca!","ab>!"));
    Path dat = _tmp.getRoot().toPath().resolve("tree.dat");
    assertEquals(1,run("--quiet=0","--timer=0",dat.toString(),in.toString()));
    assertEquals("[stack underflow]",outJson().get("error").asText());
    assertEquals("ab>!",outJson().get("name").asText());
  }

  @Test public void testLevels() {
    assertEquals(org.apache.logging.log4j.Level.OFF,Untangle.level(0));
    assertEquals(org.apache.logging.log4j.Level.WARN,Untangle.level(1));
    assertEquals(org.apache.logging.log4j.Level.INFO,Untangle.level(4));
    assertEquals(org.apache.logging.log4j.Level.DEBUG,Untangle.level(5));
    assertEquals(org.apache.logging.log4j.Level.TRACE,Untangle.level(7));
  }
}
