/** Subcommands of the {@code tenant-options} command line. */
package com.tenantoptions.cli.command;
