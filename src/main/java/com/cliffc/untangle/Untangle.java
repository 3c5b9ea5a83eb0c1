package com.cliffc.untangle;

import com.cliffc.untangle.group.GroupTree;
import com.cliffc.untangle.io.Notation;
import com.cliffc.untangle.io.TreeFile;
import com.cliffc.untangle.io.TreeJson;
import com.cliffc.untangle.sig.GeneratedOracle;
import com.cliffc.untangle.util.Ary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line front end.
 * <pre>
 *   untangle [options] &lt;output.dat&gt; &lt;input.json&gt;         build a tree from notation
 *   untangle [options] --dump &lt;output.json&gt; &lt;input.dat&gt;  write a tree's metadata and roots
 * </pre>
 * Exit status 0 on success, 1 on failure; failures print one line of JSON.
 */
public class Untangle {
  private static final Logger LOG = LogManager.getLogger(Untangle.class);

  static final String USAGE =
    "usage: untangle [options] <output.dat> <input.json>\n"+
    "       untangle [options] --dump <output.json> <input.dat>\n"+
    "  --force           overwrite existing output\n"+
    "  --maxnode=N       arena capacity [default="+Context.DEFAULT_MAXNODE+"]\n"+
    "  --maxdepth=N      re-expansion depth [default="+Context.DEFAULT_MAXDEPTH+"]\n"+
    "  --member          re-expand through alternate member structures\n"+
    "  --timer=S         progress interval in seconds, 0 is off\n"+
    "  --quiet[=N]       less output\n"+
    "  --verbose[=N]     more output\n"+
    "  --[no-]paranoid   validate the tree after every change\n"+
    "  --[no-]pure       only appreciated operators in compound signatures\n"+
    "  --[no-]rewrite    search operand combinations through the signatures\n"+
    "  --[no-]cascade    re-expand multi-node signatures\n"+
    "  --help            this text\n";

  public static void main( String[] args ) {
    System.exit(run(args,System.out));
  }

  /** @return process exit status */
  public static int run( String[] args, PrintStream out ) {
    try {
      Context ctx = new Context();
      Ary<String> files = new Ary<>(String.class);
      boolean dump = false;
      for( String arg : args ) {
        if( !arg.startsWith("--") ) { files.add(arg); continue; }
        String opt = arg, val = null;
        int eq = arg.indexOf('=');
        if( eq > 0 ) { opt = arg.substring(0,eq); val = arg.substring(eq+1); }
        switch( opt ) {
        case "--help":        out.print(USAGE); return 0;
        case "--dump":        dump = true; break;
        case "--force":       ctx._force = true; break;
        case "--member":      ctx._expand = Context.Expand.MEMBER; break;
        case "--maxnode":     ctx._maxNode  = intArg(opt,val); break;
        case "--maxdepth":    ctx._maxDepth = intArg(opt,val); break;
        case "--timer":       ctx._timer    = intArg(opt,val); break;
        case "--quiet":       ctx._verbose  = val == null ? ctx._verbose-1 : intArg(opt,val); break;
        case "--verbose":     ctx._verbose  = val == null ? ctx._verbose+1 : intArg(opt,val); break;
        case "--paranoid":    ctx.flag(Context.MAGICMASK_PARANOID,true ); break;
        case "--no-paranoid": ctx.flag(Context.MAGICMASK_PARANOID,false); break;
        case "--pure":        ctx.flag(Context.MAGICMASK_PURE    ,true ); break;
        case "--no-pure":     ctx.flag(Context.MAGICMASK_PURE    ,false); break;
        case "--rewrite":     ctx.flag(Context.MAGICMASK_REWRITE ,true ); break;
        case "--no-rewrite":  ctx.flag(Context.MAGICMASK_REWRITE ,false); break;
        case "--cascade":     ctx.flag(Context.MAGICMASK_CASCADE ,true ); break;
        case "--no-cascade":  ctx.flag(Context.MAGICMASK_CASCADE ,false); break;
        default: throw new UntangleException(ErrMsg.usage("unknown option").put("option",arg));
        }
      }
      if( files._len != 2 )
        throw new UntangleException(ErrMsg.usage("expected an output and an input file").put("usage",USAGE));
      Configurator.setRootLevel(level(ctx._verbose));

      Path output = Paths.get(files.at(0)), input = Paths.get(files.at(1));
      if( Files.exists(output) && !ctx._force )
        throw new UntangleException(ErrMsg.usage("output file exists, use --force to overwrite").put("filename",output.toString()));
      if( !Files.exists(input) )
        throw new UntangleException(ErrMsg.io("input file not found",input.toString(),null));

      GeneratedOracle db = new GeneratedOracle(ctx);
      LOG.info("signatures={} members={} flags={}",db.numSignatures(),db.numMembers(),Context.flagsToText(ctx._flags));
      if( dump ) dump(ctx,db,output,input);
      else build(ctx,db,output,input,out);
      return 0;
    } catch( UntangleException e ) {
      out.println(e._err.toJson());
      return 1;
    } catch( InconsistencyException e ) {
      LOG.error("internal inconsistency",e);
      out.println(ErrMsg.internal(e.getMessage()).toJson());
      return 1;
    }
  }

  private static void build( Context ctx, GeneratedOracle db, Path output, Path input, PrintStream out ) {
    JsonNode in = TreeJson.read(input);
    if( !in.isObject() )
      throw new UntangleException(ErrMsg.format("expected a json object",input.toString()));
    // Names and dimensions first, then the roots one by one for progress reports
    ObjectNode meta = in.deepCopy();
    JsonNode data = meta.remove("data");
    GroupTree t = TreeJson.build(meta,input.toString(),ctx,db);
    if( data != null ) {
      if( !data.isArray() || data.size() != t._numRoots )
        throw new UntangleException(ErrMsg.format("Incorrect number of data",input.toString()).put("expected",t._numRoots).put("encountered",data.isArray() ? data.size() : 1));
      Notation note = new Notation(t);
      long last = System.nanoTime();
      for( int i=0; i<t._numRoots; i++ ) {
        t._roots[i] = note.loadStringSafe(data.get(i).asText());
        if( ctx._timer > 0 && System.nanoTime()-last >= ctx._timer*1_000_000_000L ) {
          last = System.nanoTime();
          LOG.info("progress {}/{} ncount={}",i+1,t._numRoots,t._ncount);
        }
      }
    }
    for( int i=0; i<t._numRoots; i++ ) t._roots[i] = t.chaseRef(t._roots[i]);
    if( ctx.paranoid() ) t.validateTree(false);

    byte[] bytes = TreeFile.save(t,output);
    out.println(TreeJson.headerInfo(TreeJson.object().put("filename",output.toString()),bytes));
  }

  private static void dump( Context ctx, GeneratedOracle db, Path output, Path input ) {
    GroupTree t = TreeFile.load(input,ctx,db,true);
    TreeJson.write(output,TreeJson.toJson(t));
    LOG.info("wrote {} roots to {}",t._numRoots,output);
  }

  static Level level( int verbose ) {
    switch( verbose ) {
    case 0:  return Level.OFF;
    case 1:  return Level.WARN;
    case 2: case 3: case 4: return Level.INFO;
    case 5:  return Level.DEBUG;
    default: return verbose < 0 ? Level.OFF : Level.TRACE;
    }
  }

  private static int intArg( String opt, String val ) {
    try {
      if( val == null ) throw new NumberFormatException("missing value");
      return Integer.parseInt(val);
    } catch( NumberFormatException e ) {
      throw new UntangleException(ErrMsg.usage("bad numeric option").put("option",opt).put("value",String.valueOf(val)),e);
    }
  }
}
