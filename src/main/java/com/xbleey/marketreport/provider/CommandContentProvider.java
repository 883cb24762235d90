package com.xbleey.marketreport.provider;

import com.xbleey.marketreport.notify.ReportDelivery;
import com.xbleey.marketreport.task.TaskCommand;
import com.xbleey.marketreport.task.TaskRunner;

import java.util.Optional;

/**
 * Local tier: a deterministic script run through the task runner.
 */
public class CommandContentProvider extends DeliveringContentProvider {

    private final TaskRunner taskRunner;
    private final TaskCommand command;

    public CommandContentProvider(String name, ReportDelivery delivery, TaskRunner taskRunner, TaskCommand command) {
        super(name, delivery);
        this.taskRunner = taskRunner;
        this.command = command;
    }

    @Override
    protected Optional<String> produce() {
        return taskRunner.execute(getName(), command).messageText();
    }
}
