package com.esc.gitlabtools;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GitLabToolsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GitLabToolsApplication.class, args)));
    }
}
