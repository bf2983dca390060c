package com.healloop.core.proposal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Locations of the file-backed proposal and knowledge stores.
 */
@Component
@ConfigurationProperties(prefix = "healloop")
public class StoreProperties {

    private Proposals proposals = new Proposals();
    private Knowledge knowledge = new Knowledge();

    public Proposals getProposals() {
        return proposals;
    }

    public void setProposals(Proposals proposals) {
        this.proposals = proposals;
    }

    public Knowledge getKnowledge() {
        return knowledge;
    }

    public void setKnowledge(Knowledge knowledge) {
        this.knowledge = knowledge;
    }

    public static class Proposals {
        private String storeFile = "data/proposals.json";
        /** Directory patch paths are resolved against. */
        private String workspaceRoot = ".";

        public String getStoreFile() {
            return storeFile;
        }

        public void setStoreFile(String storeFile) {
            this.storeFile = storeFile;
        }

        public String getWorkspaceRoot() {
            return workspaceRoot;
        }

        public void setWorkspaceRoot(String workspaceRoot) {
            this.workspaceRoot = workspaceRoot;
        }
    }

    public static class Knowledge {
        private String storeFile = "data/knowledge.json";

        public String getStoreFile() {
            return storeFile;
        }

        public void setStoreFile(String storeFile) {
            this.storeFile = storeFile;
        }
    }
}
