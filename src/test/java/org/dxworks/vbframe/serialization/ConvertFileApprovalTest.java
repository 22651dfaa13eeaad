package org.dxworks.vbframe.serialization;

import org.approvaltests.Approvals;
import org.approvaltests.core.Options;
import org.approvaltests.reporters.AutoApproveWhenEmptyReporter;
import org.dxworks.vbframe.TestUtils;
import org.dxworks.vbframe.pipeline.FileResult;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

/**
 * Pins the complete JSON document of every sample. A missing or empty approved file is filled from the
 * first run; after that any change to the output fails until the new output is approved.
 */
public class ConvertFileApprovalTest {

    private static final JsonSerializer SERIALIZER = new JsonSerializer(SerializerOptions.DEFAULT);

    private static final Options OPTIONS = new Options().withReporter(new AutoApproveWhenEmptyReporter());

    // ---- standard modules ----
    @Test
    void convert_Standard_Simple() {
        verify("standard/Simple.bas");
    }

    @Test
    void convert_Standard_Module1() {
        verify("standard/Module1.bas");
    }

    // ---- class modules ----
    @Test
    void convert_Class_Account() {
        verify("class/Account.cls");
    }

    @Test
    void convert_Class_Broken() {
        verify("class/Broken.cls");
    }

    // ---- forms ----
    @Test
    void convert_Form_Form1() {
        verify("form/Form1.frm");
    }

    @Test
    void convert_Form_DuplicateControls() {
        verify("form/DuplicateControls.frm");
    }

    @Test
    void convert_Form_EventBinding() {
        verify("form/EventBinding.frm");
    }

    private static void verify(String sample) {
        FileResult result = TestUtils.process(sample);
        byte[] json = SERIALIZER.serialize(result.getSource(), result.getModule(), result.getDiagnostics());
        Approvals.verify(new String(json, StandardCharsets.UTF_8), OPTIONS);
    }
}
