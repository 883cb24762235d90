package com.xbleey.marketreport.cli;

@FunctionalInterface
public interface ApplicationExitHandler {

    void exit(int exitCode);
}
