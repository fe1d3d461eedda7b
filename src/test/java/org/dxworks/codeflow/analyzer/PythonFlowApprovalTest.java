package org.dxworks.codeflow.analyzer;

import org.approvaltests.Approvals;
import org.dxworks.codeflow.Language;
import org.dxworks.codeflow.dfg.DfgPathFormatter;
import org.dxworks.codeflow.model.FileFlowAnalysis;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.dxworks.codeflow.TestUtils.analyzeSample;

public class PythonFlowApprovalTest {

    @Test
    void report_SampleFunction() throws IOException {
        FileFlowAnalysis analysis = analyzeSample("python/sample_function.py", Language.PYTHON);
        Approvals.verify(DfgPathFormatter.formatReport(analysis));
    }
}
