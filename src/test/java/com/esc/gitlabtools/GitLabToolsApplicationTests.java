package com.esc.gitlabtools;

import com.esc.gitlabtools.cli.GitLabToolsCommand;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class GitLabToolsApplicationTests {

    @Autowired
    private GitLabToolsCommand gitLabToolsCommand;

    @Autowired
    private IFactory factory;

    private String run(String... args) {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(gitLabToolsCommand, factory);
        commandLine.setOut(new PrintWriter(out));
        assertEquals(0, commandLine.execute(args));
        return out.toString();
    }

    @Test
    void shouldPrintVersion() {
        assertEquals(GitLabToolsCommand.VERSION, run("version").trim());
        assertEquals(GitLabToolsCommand.VERSION, run("--version").trim());
    }

    @Test
    void shouldListSubcommandsInUsage() {
        String usage = run("--help");

        assertTrue(usage.contains("bulk-mr"));
        assertTrue(usage.contains("bulk-mr-topic"));
        assertTrue(usage.contains("merge"));
        assertTrue(usage.contains("topics"));
        assertTrue(usage.contains("projects"));
    }
}
