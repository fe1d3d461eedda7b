package org.dxworks.codeflow.analyzer;

import org.dxworks.codeflow.CodeflowConfig;
import org.dxworks.codeflow.Language;
import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.ast.FrontEndException;
import org.dxworks.codeflow.ast.LineFrontEnd;
import org.dxworks.codeflow.ast.TreeSitterFrontEnd;
import org.dxworks.codeflow.ast.grammar.Grammar;
import org.dxworks.codeflow.ast.grammar.TokenTable;
import org.dxworks.codeflow.cfg.CfgBuilder;
import org.dxworks.codeflow.cfg.PathEnumerator;
import org.dxworks.codeflow.dfg.DefUseAnalyzer;
import org.dxworks.codeflow.dfg.DfgPathAssembler;
import org.dxworks.codeflow.dfg.ProcedureVariables;
import org.dxworks.codeflow.dfg.VariableCollector;
import org.dxworks.codeflow.dfg.VariableExtractor;
import org.dxworks.codeflow.model.Block;
import org.dxworks.codeflow.model.BlockInfo;
import org.dxworks.codeflow.model.Cfg;
import org.dxworks.codeflow.model.DfgPath;
import org.dxworks.codeflow.model.EdgeInfo;
import org.dxworks.codeflow.model.FileFlowAnalysis;
import org.dxworks.codeflow.model.Link;
import org.dxworks.codeflow.model.Occurrence;
import org.dxworks.codeflow.model.ProcedureFlow;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Control-flow and data-flow analysis of every procedure in one source file.
 * <p>
 * Files the tree-sitter front end cannot handle are analyzed line by line as a single procedure
 * named after the file, and the result is flagged as degraded.
 */
public class FlowAnalyzer {

    private final CodeflowConfig config;

    public FlowAnalyzer(CodeflowConfig config) {
        this.config = config;
    }

    public FileFlowAnalysis analyze(String filePath, String sourceCode, Language language) {
        FileFlowAnalysis analysis = new FileFlowAnalysis();
        analysis.filePath = filePath;
        analysis.language = language.getName();

        TokenTable tokens = Grammar.of(language).tokens();
        VariableExtractor extractor = new VariableExtractor(tokens);
        VariableCollector collector = new VariableCollector(extractor, tokens);

        AstNode root;
        try {
            root = new TreeSitterFrontEnd(language, config.isFallbackOnSyntaxError()).parse(sourceCode);
        } catch (FrontEndException e) {
            System.err.println("Warning: " + e.getMessage() + "; analyzing " + filePath + " line by line");
            analysis.degraded = true;
            AstNode body = new LineFrontEnd(language == Language.JAVA).parse(sourceCode);
            Cfg cfg = new CfgBuilder().buildSequential(baseName(filePath), body);
            analysis.procedures.add(describe(cfg, extractor, collector));
            return analysis;
        }

        for (ProcedureLocator.LocatedProcedure procedure : ProcedureLocator.locate(root)) {
            CfgBuilder builder = new CfgBuilder(config.isSeparateNodeBlocks(), config.isModelSwitchFallthrough());
            Cfg cfg = builder.build(procedure.getName(), procedure.getNode());
            analysis.procedures.add(describe(cfg, extractor, collector));
        }
        return analysis;
    }

    ProcedureFlow describe(Cfg cfg, VariableExtractor extractor, VariableCollector collector) {
        ProcedureFlow flow = new ProcedureFlow();
        flow.name = cfg.getName();

        List<Occurrence> parameters = List.of();
        Set<String> tracked = null;
        AstNode procedure = cfg.getProcedure();
        if (procedure != null) {
            ProcedureVariables variables = collector.collect(procedure);
            parameters = variables.getParameters();
            tracked = variables.tracked();
            flow.line = procedure.line();
        } else if (cfg.getEntryBlock() != null) {
            flow.line = cfg.getEntryBlock().getLine();
        }

        if (cfg.getEntryBlock() != null) {
            flow.entryBlock = cfg.getEntryBlock().getId();
        }
        for (Block block : cfg.blocks()) {
            flow.blocks.add(describe(block));
        }
        cfg.getFinalBlocks().forEach(block -> flow.finalBlocks.add(block.getId()));
        flow.diagnostics.addAll(cfg.getDiagnostics());

        List<List<Block>> routes = new PathEnumerator(config.getMaxPathDepth(), config.getMaxPaths()).enumerate(cfg);
        flow.pathCount = routes.size();

        List<DfgPath> paths = new DfgPathAssembler(extractor, config.getAssemblyMode()).assemble(routes, parameters, tracked);
        for (Map.Entry<String, List<DfgPath>> group : DfgPathAssembler.groupByVariable(paths).entrySet()) {
            flow.dataFlowPaths.put(group.getKey(),
                    group.getValue().stream().map(DfgPath::toString).collect(Collectors.toList()));
        }

        flow.defUsePaths.addAll(new DefUseAnalyzer(extractor, config.getDefUseMaxDepth(), config.getMaxPaths())
                .analyze(cfg, parameters, tracked));

        for (Cfg nested : cfg.getFunctionCfgs().values()) {
            ProcedureFlow nestedFlow = describe(nested, extractor, collector);
            nestedFlow.name = flow.name + "." + nested.getName();
            flow.nestedProcedures.add(nestedFlow);
        }
        return flow;
    }

    private static BlockInfo describe(Block block) {
        BlockInfo info = new BlockInfo();
        info.id = block.getId();
        info.line = block.getLine();
        info.source = block.getSource();
        for (Link exit : block.getExits()) {
            EdgeInfo edge = new EdgeInfo();
            edge.target = exit.getTarget().getId();
            edge.exitcase = exit.getExitcase();
            info.exits.add(edge);
        }
        return info;
    }

    private static String baseName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
