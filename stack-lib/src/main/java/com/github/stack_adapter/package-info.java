// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains a last-in-first-out adapter that puts a minimal stack interface over a swappable storage
/// strategy.
///
/// The [com.github.stack_adapter.StackAdapter] owns one container and forwards `push`, `pop`, `top`, `emplace`,
/// `size` and `empty` to the container's back insertion, back removal and back access. Changing the storage
/// strategy means changing the container type and nothing at the call sites.
///
/// To adapt your own storage implement [com.github.stack_adapter.StackContainer]. The supplied containers are:
/// - [com.github.stack_adapter.ArrayContainer]: contiguous storage and the default choice.
/// - [com.github.stack_adapter.LinkedContainer]: a doubly linked sequence.
/// - [com.github.stack_adapter.DequeContainer]: a double-ended buffer that rejects `null` elements.
/// - [com.github.stack_adapter.TextContainer]: characters in a string buffer.
///
/// Supporting classes:
/// - [com.github.stack_adapter.Lexicographic]: the ordering used to compare two stacks.
/// - [com.github.stack_adapter.StackLogger]: the JUL logger for this package.
///
/// Nothing in this package is thread safe.
package com.github.stack_adapter;
